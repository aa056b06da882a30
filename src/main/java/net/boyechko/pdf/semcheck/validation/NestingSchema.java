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
package net.boyechko.pdf.semcheck.validation;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.pdf.semcheck.document.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Parent/child rules for structure roles, loaded from YAML. A role with no entry, or with neither
 * {@code allowed_children} nor {@code forbidden_children}, accepts any child.
 */
public final class NestingSchema {
    private static final String DEFAULT_SCHEMA_RESOURCE = "/nesting-schema.yaml";
    private static final Logger logger = LoggerFactory.getLogger(NestingSchema.class);

    public Map<String, RuleSpec> roles;

    private final Map<Role, Rule> resolved = new EnumMap<>(Role.class);

    /** Rule as written in the YAML file. */
    public static final class RuleSpec {
        public Set<String> allowed_children;
        public Set<String> forbidden_children;
        public Set<String> required_children;
        public Integer min_children;
        public Boolean may_be_empty;
    }

    /** Rule resolved to roles. */
    public record Rule(
            Set<Role> allowedChildren,
            Set<Role> forbiddenChildren,
            Set<Role> requiredChildren,
            int minChildren,
            boolean mayBeEmpty) {

        static final Rule UNRESTRICTED = new Rule(Set.of(), Set.of(), Set.of(), 0, false);

        public boolean allows(Role child) {
            if (!allowedChildren.isEmpty() && !allowedChildren.contains(child)) return false;
            return !forbiddenChildren.contains(child);
        }
    }

    public NestingSchema() {
        this.roles = new HashMap<>();
    }

    /**
     * Load NestingSchema from classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static NestingSchema fromResource(String resourcePath) {
        try (var inputStream = NestingSchema.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }

            var yaml = new Yaml(new Constructor(NestingSchema.class, new LoaderOptions()));
            NestingSchema schema = yaml.load(inputStream);
            if (schema.roles == null) {
                schema.roles = new HashMap<>();
            }
            schema.resolve();
            logger.debug(
                    "Loaded NestingSchema with {} roles from resource {}",
                    schema.roles.size(),
                    resourcePath);

            var warnings = schema.validateConsistency();
            if (!warnings.isEmpty()) {
                logger.warn(
                        "Schema loaded from {} has {} consistency warnings:",
                        resourcePath,
                        warnings.size());
                for (String warning : warnings) {
                    logger.warn("  - {}", warning);
                }
            }
            return schema;
        } catch (Exception e) {
            logger.error(
                    "Failed to load NestingSchema from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new IllegalStateException(
                    "Failed to load schema from resource " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    /** Load default schema from standard location */
    public static NestingSchema loadDefault() {
        return fromResource(DEFAULT_SCHEMA_RESOURCE);
    }

    /** A schema holding only the list rules. */
    public static NestingSchema minimal() {
        NestingSchema s = new NestingSchema();

        RuleSpec l = new RuleSpec();
        l.allowed_children = Set.of("LI");
        s.roles.put("L", l);

        RuleSpec li = new RuleSpec();
        li.allowed_children = Set.of("Lbl", "LBody", "L");
        li.required_children = Set.of("LBody");
        s.roles.put("LI", li);

        s.resolve();
        return s;
    }

    public Rule ruleFor(Role role) {
        return resolved.getOrDefault(role, Rule.UNRESTRICTED);
    }

    public boolean isAllowedChild(Role parent, Role child) {
        return ruleFor(parent).allows(child);
    }

    public Set<Role> definedRoles() {
        return resolved.isEmpty() ? EnumSet.noneOf(Role.class) : EnumSet.copyOf(resolved.keySet());
    }

    private void resolve() {
        resolved.clear();
        for (Map.Entry<String, RuleSpec> entry : roles.entrySet()) {
            RuleSpec spec = entry.getValue() != null ? entry.getValue() : new RuleSpec();
            resolved.put(
                    toRole(entry.getKey()),
                    new Rule(
                            toRoles(spec.allowed_children),
                            toRoles(spec.forbidden_children),
                            toRoles(spec.required_children),
                            spec.min_children != null ? spec.min_children : 0,
                            Boolean.TRUE.equals(spec.may_be_empty)));
        }
    }

    private static Role toRole(String name) {
        return Role.fromStructureType(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown role in schema: " + name));
    }

    private static Set<Role> toRoles(Set<String> names) {
        if (names == null || names.isEmpty()) return Set.of();
        Set<Role> out = EnumSet.noneOf(Role.class);
        for (String name : names) {
            out.add(toRole(name));
        }
        return Set.copyOf(out);
    }

    /**
     * Validates the internal consistency of the schema and returns a list of warnings: roles both
     * allowed and forbidden under a parent, required children the parent does not allow, and a
     * minimum child count on a role that may be empty.
     *
     * @return List of warning messages describing inconsistencies (empty if schema is consistent)
     */
    public List<String> validateConsistency() {
        List<String> warnings = new ArrayList<>();

        for (Map.Entry<Role, Rule> entry : resolved.entrySet()) {
            Role role = entry.getKey();
            Rule rule = entry.getValue();

            for (Role child : rule.allowedChildren()) {
                if (rule.forbiddenChildren().contains(child)) {
                    warnings.add(
                            String.format(
                                    "Contradiction: <%s> both allows and forbids <%s>",
                                    role, child));
                }
            }

            for (Role required : rule.requiredChildren()) {
                if (!rule.allows(required)) {
                    warnings.add(
                            String.format(
                                    "Contradiction: <%s> requires child <%s> but doesn't allow it",
                                    role, required));
                }
            }

            if (rule.minChildren() > 0 && rule.mayBeEmpty()) {
                warnings.add(
                        String.format(
                                "Contradiction: <%s> has min_children=%d but may be empty",
                                role, rule.minChildren()));
            }
        }

        return warnings;
    }
}
