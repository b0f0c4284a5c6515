package com.example.subburn_backend.config;

import com.example.subburn_backend.dto.render.SubtitleStyle;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Look of the burned-in subtitles. Defaults give the white-on-black-outline bottom-center style.
 * Colors accept {@code #RRGGBB}, {@code #RGB} or {@code rgba(r,g,b,a)}.
 */
@Validated
@ConfigurationProperties(prefix = "subtitle.style")
public class SubtitleStyleProperties {

    @NotBlank
    private String fontFamily = "Arial";

    @Min(1)
    private int fontSize = 10;

    @NotBlank
    private String primaryColor = "#FFFFFF";

    @NotBlank
    private String outlineColor = "#000000";

    private int borderStyle = 1;
    private int outline = 1;
    private int shadow = 0;
    private boolean bold = false;

    @Min(0)
    private int marginV = 10;

    @Pattern(regexp = "left|center|right")
    private String alignment = "center";

    public SubtitleStyle toStyle() {
        return new SubtitleStyle(fontFamily, fontSize, primaryColor, outlineColor, borderStyle, outline, shadow,
                bold, marginV, alignment);
    }

    public String getFontFamily() { return fontFamily; }
    public void setFontFamily(String fontFamily) { this.fontFamily = fontFamily; }

    public int getFontSize() { return fontSize; }
    public void setFontSize(int fontSize) { this.fontSize = fontSize; }

    public String getPrimaryColor() { return primaryColor; }
    public void setPrimaryColor(String primaryColor) { this.primaryColor = primaryColor; }

    public String getOutlineColor() { return outlineColor; }
    public void setOutlineColor(String outlineColor) { this.outlineColor = outlineColor; }

    public int getBorderStyle() { return borderStyle; }
    public void setBorderStyle(int borderStyle) { this.borderStyle = borderStyle; }

    public int getOutline() { return outline; }
    public void setOutline(int outline) { this.outline = outline; }

    public int getShadow() { return shadow; }
    public void setShadow(int shadow) { this.shadow = shadow; }

    public boolean isBold() { return bold; }
    public void setBold(boolean bold) { this.bold = bold; }

    public int getMarginV() { return marginV; }
    public void setMarginV(int marginV) { this.marginV = marginV; }

    public String getAlignment() { return alignment; }
    public void setAlignment(String alignment) { this.alignment = alignment; }
}
