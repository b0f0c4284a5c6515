package com.example.subburn_backend.engine;

import com.example.subburn_backend.dto.render.SubtitleStyle;
import com.example.subburn_backend.engine.Interfaces.SubtitleBurnEngine;
import com.example.subburn_backend.engine.Interfaces.ToolRunner;
import com.example.subburn_backend.exception.ToolInvocationException;
import com.example.subburn_backend.ffmpeg.AssStyleUtil;
import com.example.subburn_backend.service.events.SubscriberHandle;
import org.springframework.lang.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Burns an srt into the video with ffmpeg's {@code subtitles} filter.
 *
 * <p>The filter argument has its own escaping rules on top of the path, so the srt is referenced by a short name
 * relative to the process working directory instead of an absolute path.
 */
public class FfmpegSubtitleBurnEngine implements SubtitleBurnEngine {

    private final ToolRunner toolRunner;
    private final String ffmpegBin;
    private final SubtitleStyle style;

    public FfmpegSubtitleBurnEngine(ToolRunner toolRunner, String ffmpegBin, SubtitleStyle style) {
        this.toolRunner = toolRunner;
        this.ffmpegBin = ffmpegBin != null ? ffmpegBin : "ffmpeg";
        this.style = style != null ? style : SubtitleStyle.defaults();
    }

    @Override
    public void burn(Path sourceVideo, Path workDir, String subtitleFileName, Path outputVideo,
                     @Nullable SubscriberHandle subscriber) throws ToolInvocationException {
        toolRunner.run(ToolCommand.of("ffmpeg", List.of(
                ffmpegBin, "-y",
                "-i", sourceVideo.toAbsolutePath().toString(),
                "-vf", subtitleFilter(subtitleFileName),
                outputVideo.toAbsolutePath().toString()
        )).inDirectory(workDir), subscriber);
    }

    String subtitleFilter(String subtitleFileName) {
        return "subtitles='" + AssStyleUtil.escapeForFilter(subtitleFileName) + "'"
                + ":force_style='" + AssStyleUtil.buildForceStyle(style) + "'";
    }
}
