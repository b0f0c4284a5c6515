package com.example.subburn_backend.ffmpeg;

import com.example.subburn_backend.dto.render.SubtitleStyle;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AssStyleUtilTest {

    @Test
    void toAssColorConvertsHexWhiteAndBlack() {
        assertThat(AssStyleUtil.toAssColor("#FFFFFF")).isEqualTo("&H00FFFFFF");
        assertThat(AssStyleUtil.toAssColor("#000")).isEqualTo("&H00000000");
    }

    @Test
    void toAssColorSwapsChannelOrder() {
        assertThat(AssStyleUtil.toAssColor("#FF8000")).isEqualTo("&H000080FF");
    }

    @Test
    void toAssColorConvertsRgbaWithAlpha() {
        assertThat(AssStyleUtil.toAssColor("rgba(0,0,0,0.5)")).isEqualTo("&H80000000");
        assertThat(AssStyleUtil.toAssColor("rgba(255, 255, 255, 1)")).isEqualTo("&H00FFFFFF");
    }

    @Test
    void defaultForceStyleMatchesBurnInLook() {
        assertThat(AssStyleUtil.buildForceStyle(SubtitleStyle.defaults())).isEqualTo(
                "Fontname=Arial,Fontsize=10,PrimaryColour=&H00FFFFFF,OutlineColour=&H00000000,"
                        + "BorderStyle=1,Outline=1,Shadow=0,Bold=0,MarginV=10,Alignment=2");
    }

    @Test
    void buildForceStyleUsesDefaultsWhenNull() {
        assertThat(AssStyleUtil.buildForceStyle(null)).isEqualTo(AssStyleUtil.buildForceStyle(SubtitleStyle.defaults()));
    }

    @Test
    void escapeForFilterEscapesSeparatorsAndQuotes() {
        assertThat(AssStyleUtil.escapeForFilter("C:\\subs\\it's.srt")).isEqualTo("C\\:\\\\subs\\\\it\\'s.srt");
        assertThat(AssStyleUtil.escapeForFilter("temp_1700000000000-movie.srt")).isEqualTo("temp_1700000000000-movie.srt");
    }
}
