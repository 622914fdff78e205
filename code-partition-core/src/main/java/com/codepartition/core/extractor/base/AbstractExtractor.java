package com.codepartition.core.extractor.base;

import com.codepartition.core.extractor.EntityExtractor;
import com.codepartition.core.extractor.ExtractionException;
import com.codepartition.core.extractor.SourceFile;
import com.codepartition.core.model.FileExtraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Abstract base class for extractor implementations providing common functionality.
 *
 * <p>This class reduces code duplication across extractor implementations by providing:
 * <ul>
 *   <li>Logger initialization (one logger per extractor class)</li>
 *   <li>The {@link #extract(SourceFile)} template around an {@link ExtractionBuilder}</li>
 *   <li>Parameter list splitting ({@link #splitTopLevel(String)}, {@link #parameterNames(String, boolean)})</li>
 * </ul>
 *
 * <p>Concrete extractors implement {@link #parse(SourceFile, ExtractionBuilder)} and
 * report declarations in source order.
 *
 * @see EntityExtractor
 */
public abstract class AbstractExtractor implements EntityExtractor {

    /**
     * Logger instance for this extractor.
     * Automatically initialized with the concrete extractor class name.
     */
    protected final Logger log;

    protected AbstractExtractor() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public FileExtraction extract(SourceFile source) throws ExtractionException {
        ExtractionBuilder builder = new ExtractionBuilder(source);
        parse(source, builder);
        return builder.build();
    }

    /**
     * Parses the file and reports its declarations, references and imports.
     *
     * @param source file to parse
     * @param builder collector for the results
     * @throws ExtractionException if the file cannot be parsed
     */
    protected abstract void parse(SourceFile source, ExtractionBuilder builder) throws ExtractionException;

    // ==================== Parameter Utilities ====================

    /**
     * Splits a comma separated list, ignoring commas nested in brackets.
     *
     * @param text list text without the surrounding parentheses
     * @return trimmed, non-empty items
     */
    protected List<String> splitTopLevel(String text) {
        List<String> items = new ArrayList<>();
        if (text == null) {
            return items;
        }
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{' || c == '<') {
                depth++;
            } else if ((c == ')' || c == ']' || c == '}' || c == '>') && depth > 0) {
                depth--;
            } else if (c == ',' && depth == 0) {
                addItem(items, text.substring(start, i));
                start = i + 1;
            }
        }
        addItem(items, text.substring(start));
        return items;
    }

    /**
     * Extracts parameter names from a parameter list.
     *
     * <p>Default values are dropped. With {@code nameFirst} the name precedes an
     * optional {@code : type} annotation (Python, TypeScript); otherwise the name is
     * the last identifier of the declaration (C family, PHP).
     *
     * @param text parameter list without parentheses
     * @param nameFirst true for {@code name: Type} syntax
     * @return parameter names in order
     */
    protected List<String> parameterNames(String text, boolean nameFirst) {
        List<String> names = new ArrayList<>();
        for (String item : splitTopLevel(text)) {
            String declaration = stripDefault(item).strip();
            String name;
            if (nameFirst) {
                int colon = declaration.indexOf(':');
                name = colon < 0 ? declaration : declaration.substring(0, colon);
                String[] words = name.replace("?", "").strip().split("\\s+");
                name = words[words.length - 1];
            } else {
                name = lastIdentifier(declaration.replaceAll("\\[[^\\]]*\\]", ""));
            }
            name = name.replaceAll("^[*&.$]+", "").strip();
            if (!name.isEmpty() && !name.equals("void")) {
                names.add(name);
            }
        }
        return names;
    }

    private static String stripDefault(String item) {
        int depth = 0;
        for (int i = 0; i < item.length(); i++) {
            char c = item.charAt(i);
            if (c == '(' || c == '[' || c == '{' || c == '<') {
                depth++;
            } else if ((c == ')' || c == ']' || c == '}' || c == '>') && depth > 0) {
                depth--;
            } else if (c == '=' && depth == 0) {
                return item.substring(0, i);
            }
        }
        return item;
    }

    private static String lastIdentifier(String declaration) {
        int end = declaration.length();
        while (end > 0 && !isIdentifierChar(declaration.charAt(end - 1))) {
            end--;
        }
        int start = end;
        while (start > 0 && isIdentifierChar(declaration.charAt(start - 1))) {
            start--;
        }
        return declaration.substring(start, end);
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static void addItem(List<String> items, String item) {
        String trimmed = item.strip();
        if (!trimmed.isEmpty()) {
            items.add(trimmed);
        }
    }
}
