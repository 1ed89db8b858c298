package com.phillippitts.mediatoolbox.config.properties;

import com.phillippitts.mediatoolbox.domain.ToolKind;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Locations of the external tools.
 * Binds to properties prefixed with "tools".
 *
 * <p>Example application.properties:
 * <pre>
 * tools.bundled-dir=bin
 * tools.transcoder-binary=ffmpeg
 * tools.downloader-binary=yt-dlp
 * </pre>
 *
 * @param bundledDir directory, relative to the application home, searched first for bundled binaries
 * @param transcoderBinary executable name of the transcoder
 * @param downloaderBinary executable name of the downloader
 */
@ConfigurationProperties(prefix = "tools")
@Validated
public record ToolProperties(
        @DefaultValue("bin")
        @NotBlank(message = "Bundled tool directory must not be blank")
        String bundledDir,

        @DefaultValue("ffmpeg")
        @NotBlank(message = "Transcoder binary name must not be blank")
        String transcoderBinary,

        @DefaultValue("yt-dlp")
        @NotBlank(message = "Downloader binary name must not be blank")
        String downloaderBinary
) {

    public static ToolProperties defaults() {
        return new ToolProperties("bin", "ffmpeg", "yt-dlp");
    }

    public String binaryName(ToolKind tool) {
        return switch (tool) {
            case TRANSCODER -> transcoderBinary;
            case DOWNLOADER -> downloaderBinary;
        };
    }
}
