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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Error codes recorded against node ids, kept outside the tree so the tree stays shareable between
 * analyzers running in parallel. Analyzers only ever add to the ledger.
 */
public final class ErrorLedger {
    private final Map<String, Set<ErrorCode>> codesByNode = new ConcurrentHashMap<>();

    public void record(String nodeId, ErrorCode code) {
        codesByNode.computeIfAbsent(nodeId, k -> ConcurrentHashMap.newKeySet()).add(code);
    }

    public void record(Node node, ErrorCode code) {
        record(node.id(), code);
    }

    /** Snapshot of the codes recorded for a node; empty if none. */
    public Set<ErrorCode> codesFor(String nodeId) {
        Set<ErrorCode> codes = codesByNode.get(nodeId);
        if (codes == null || codes.isEmpty()) return Set.of();
        return Collections.unmodifiableSet(EnumSet.copyOf(codes));
    }

    public boolean hasErrors(String nodeId) {
        return !codesFor(nodeId).isEmpty();
    }

    public boolean isEmpty() {
        return codesByNode.isEmpty();
    }

    public int nodeCount() {
        return codesByNode.size();
    }

    /** Snapshot of the whole ledger, ordered by node id. */
    public Map<String, Set<ErrorCode>> snapshot() {
        Map<String, Set<ErrorCode>> copy = new TreeMap<>();
        codesByNode.forEach((id, codes) -> copy.put(id, codesFor(id)));
        return Collections.unmodifiableMap(copy);
    }
}
