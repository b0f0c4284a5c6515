package com.example.subburn_backend.config;

import com.example.subburn_backend.dto.render.SubtitleStyle;
import com.example.subburn_backend.engine.FfmpegSubtitleBurnEngine;
import com.example.subburn_backend.engine.Interfaces.ToolRunner;
import com.example.subburn_backend.engine.ToolCommand;
import com.example.subburn_backend.ffmpeg.AssStyleUtil;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SubtitleStylePropertiesTest {

    @Test
    void defaultsMatchTheStandardBurnInStyle() {
        assertThat(new SubtitleStyleProperties().toStyle()).isEqualTo(SubtitleStyle.defaults());
    }

    @Test
    void configuredStyleReachesTheBurnFilter() throws Exception {
        SubtitleStyleProperties props = new SubtitleStyleProperties();
        props.setFontFamily("DejaVu Sans");
        props.setPrimaryColor("#FF0");
        props.setOutlineColor("rgba(0, 0, 0, 0.5)");
        props.setBold(true);
        props.setAlignment("right");

        ToolRunner runner = mock(ToolRunner.class);
        new FfmpegSubtitleBurnEngine(runner, "ffmpeg", props.toStyle())
                .burn(Path.of("/in.mp4"), Path.of("/work"), "temp_x.srt", Path.of("/out.mp4"), null);

        ArgumentCaptor<ToolCommand> cmd = ArgumentCaptor.forClass(ToolCommand.class);
        verify(runner).run(cmd.capture(), isNull());
        assertThat(cmd.getValue().argv().get(5)).isEqualTo("subtitles='temp_x.srt':force_style='"
                + "Fontname=DejaVu Sans,Fontsize=10,PrimaryColour=&H0000FFFF,OutlineColour=&H80000000,"
                + "BorderStyle=1,Outline=1,Shadow=0,Bold=-1,MarginV=10,Alignment=3'");
        assertThat(AssStyleUtil.buildForceStyle(props.toStyle())).contains("Alignment=3");
    }
}
