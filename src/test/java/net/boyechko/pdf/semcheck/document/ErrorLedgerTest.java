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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;

class ErrorLedgerTest {

    @Test
    void recordsEachCodeOncePerNode() {
        ErrorLedger ledger = new ErrorLedger();
        ledger.record("n1", ErrorCode.EMPTY_ELEMENT);
        ledger.record("n1", ErrorCode.EMPTY_ELEMENT);
        ledger.record("n1", ErrorCode.DUPLICATE_ID);

        assertEquals(Set.of(ErrorCode.EMPTY_ELEMENT, ErrorCode.DUPLICATE_ID), ledger.codesFor("n1"));
        assertEquals(1, ledger.nodeCount());
        assertTrue(ledger.hasErrors("n1"));
        assertFalse(ledger.hasErrors("n2"));
        assertTrue(ledger.codesFor("n2").isEmpty());
    }

    @Test
    void snapshotIsOrderedAndDetached() {
        ErrorLedger ledger = new ErrorLedger();
        ledger.record("b", ErrorCode.EMPTY_ELEMENT);
        ledger.record("a", ErrorCode.DUPLICATE_ID);

        var snapshot = ledger.snapshot();
        ledger.record("c", ErrorCode.EMPTY_ELEMENT);

        assertEquals(List.of("a", "b"), new ArrayList<>(snapshot.keySet()));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove("a"));
    }

    @Test
    void acceptsConcurrentWriters() {
        ErrorLedger ledger = new ErrorLedger();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<Void>> writers = new ArrayList<>();
            for (ErrorCode code : ErrorCode.values()) {
                writers.add(
                        CompletableFuture.runAsync(
                                () -> {
                                    for (int i = 0; i < 50; i++) {
                                        ledger.record("node" + i, code);
                                    }
                                },
                                pool));
            }
            CompletableFuture.allOf(writers.toArray(new CompletableFuture[0])).join();
        } finally {
            pool.shutdown();
        }

        assertEquals(50, ledger.nodeCount());
        assertEquals(ErrorCode.values().length, ledger.codesFor("node7").size());
    }

    @Test
    void codesResolveFromNumbers() {
        assertEquals(1007, ErrorCode.DUPLICATE_ID.code());
        assertEquals(ErrorCode.DUPLICATE_ID, ErrorCode.fromCode(1007));
        assertThrows(IllegalArgumentException.class, () -> ErrorCode.fromCode(42));
    }
}
