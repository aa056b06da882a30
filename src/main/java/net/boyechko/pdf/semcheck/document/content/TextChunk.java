/*
 * PDF-SemCheck - Semantic Structure Validation for Tagged PDFs
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.semcheck.document.content;

import com.itextpdf.kernel.colors.Color;
import java.util.Objects;
import net.boyechko.pdf.semcheck.document.Box;

/** A run of text drawn with a single font, size, weight and fill color. */
public record TextChunk(
        String value,
        Box box,
        String fontName,
        float fontSize,
        float fontWeight,
        float italicAngle,
        Color color) {

    public static final float BOLD_WEIGHT = 600f;
    public static final float NORMAL_WEIGHT = 400f;

    public TextChunk {
        Objects.requireNonNull(value, "value");
    }

    /** A chunk with normal weight, no slant, and no color information. */
    public static TextChunk of(String value, Box box, String fontName, float fontSize) {
        return new TextChunk(value, box, fontName, fontSize, NORMAL_WEIGHT, 0f, null);
    }

    public boolean isBold() {
        return fontWeight >= BOLD_WEIGHT;
    }

    public boolean isItalic() {
        return italicAngle != 0f;
    }

    public boolean isWhitespace() {
        return value.isBlank();
    }
}
