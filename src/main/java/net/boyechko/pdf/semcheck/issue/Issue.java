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
package net.boyechko.pdf.semcheck.issue;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import net.boyechko.pdf.semcheck.document.ErrorCode;

/** A single structural defect found by one of the analyzers. */
public final class Issue {
    private final IssueType type;
    private final IssueSev severity;
    private final IssueLoc where;
    private final String message;
    private final Map<String, String> context;

    public Issue(IssueType type, IssueSev sev, String message) {
        this(type, sev, IssueLoc.none(), message, Map.of());
    }

    public Issue(IssueType type, IssueSev sev, IssueLoc where, String message) {
        this(type, sev, where, message, Map.of());
    }

    public Issue(
            IssueType type,
            IssueSev sev,
            IssueLoc where,
            String message,
            Map<String, String> context) {
        this.type = Objects.requireNonNull(type, "type");
        this.severity = Objects.requireNonNull(sev, "severity");
        this.where = where != null ? where : IssueLoc.none();
        this.message = message;
        this.context = Collections.unmodifiableMap(new TreeMap<>(context));
    }

    public IssueType type() {
        return type;
    }

    public IssueSev severity() {
        return severity;
    }

    public IssueLoc where() {
        return where;
    }

    public String message() {
        return message;
    }

    /** Extra facts about the finding, such as the roles involved or the size of a gap, by key. */
    public Map<String, String> context() {
        return context;
    }

    public String contextValue(String key) {
        return context.get(key);
    }

    public IssueCategory category() {
        return type.category();
    }

    public ErrorCode errorCode() {
        return type.errorCode();
    }

    public String nodeId() {
        return where.nodeId();
    }

    public Integer pageIndex() {
        return where.page();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity).append(' ').append(type);
        if (nodeId() != null) {
            sb.append(" @").append(nodeId());
        }
        if (pageIndex() != null) {
            sb.append(" p").append(pageIndex());
        }
        sb.append(": ").append(message);
        if (!context.isEmpty()) {
            sb.append(' ').append(context);
        }
        return sb.toString();
    }
}
