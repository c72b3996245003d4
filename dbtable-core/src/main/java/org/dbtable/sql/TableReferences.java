package org.dbtable.sql;

import lombok.Getter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites table placeholders in free-text SQL fragments.
 *
 * <ul>
 *   <li>{@code !!!} becomes the owning table's fully qualified name.</li>
 *   <li>{@code !name!} becomes the fully qualified name of the table registered as {@code name}.</li>
 * </ul>
 *
 * <p>Applied uniformly to WHERE clauses, join text, column definitions,
 * CONSTRAINT text and FOREIGN KEY text.</p>
 */
public class TableReferences {

    private static final String SELF_PLACEHOLDER = "!!!";
    private static final Pattern OTHER_TABLE_PLACEHOLDER = Pattern.compile("!(\\S+?)!");

    @Getter
    private final String fullTableName;
    private final TableReferenceResolver resolver;

    public TableReferences(String fullTableName, TableReferenceResolver resolver) {
        this.fullTableName = fullTableName;
        this.resolver = resolver;
    }

    /**
     * Substitutes every placeholder in the fragment.
     *
     * @param fragment SQL text, may be null
     * @return the rewritten text, or null if the fragment was null
     * @throws org.dbtable.exception.UnknownTableException if a {@code !name!} placeholder cannot be resolved
     */
    public String substitute(String fragment) {
        if (fragment == null || fragment.indexOf('!') < 0) {
            return fragment;
        }

        String replaced = fragment.replace(SELF_PLACEHOLDER, fullTableName);
        Matcher matcher = OTHER_TABLE_PLACEHOLDER.matcher(replaced);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(resolver.fullTableNameOf(matcher.group(1))));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
