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
package net.boyechko.pdf.semcheck.document;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class RoleTest {

    @ParameterizedTest(name = "roundTripsStructureType: {0}")
    @EnumSource(Role.class)
    void everyRoleResolvesFromItsOwnName(Role role) {
        assertEquals(Optional.of(role), Role.fromStructureType(role.structureType()));
    }

    @Test
    void resolvesCaseInsensitivelyAndByAlias() {
        assertEquals(Optional.of(Role.BLOCK_QUOTE), Role.fromStructureType("blockquote"));
        assertEquals(Optional.of(Role.LBODY), Role.fromStructureType("lbody"));
        assertEquals(Optional.of(Role.NON_STRUCT), Role.fromStructureType("nonstruct"));
        assertEquals(Optional.of(Role.HEADER), Role.fromStructureType("header"));
        assertTrue(Role.fromStructureType("Bogus").isEmpty());
        assertTrue(Role.fromStructureType(null).isEmpty());
    }

    @Test
    void headingLevelsOnlyForNumberedHeadings() {
        assertEquals(1, Role.H1.headingLevel().getAsInt());
        assertEquals(6, Role.H6.headingLevel().getAsInt());
        assertTrue(Role.H.headingLevel().isEmpty());
        assertTrue(Role.P.headingLevel().isEmpty());
        assertTrue(Role.H.isHeading());
        assertFalse(Role.P.isHeading());
    }

    @Test
    void categoriesAreConsistent() {
        assertTrue(Role.TD.isTable());
        assertTrue(Role.TD.isTableCell());
        assertFalse(Role.TR.isTableCell());
        assertTrue(Role.LBL.isList());
        assertTrue(Role.FIGURE.requiresAlternativeText());
        assertTrue(Role.SECT.isGrouping());
        assertFalse(Role.P.isGrouping());
        assertEquals("BlockQuote", Role.BLOCK_QUOTE.toString());
    }
}
