package com.codepartition.cli;

import com.codepartition.core.extractor.EntityExtractor;
import com.codepartition.core.extractor.ExtractorRegistry;
import com.codepartition.core.model.Language;
import picocli.CommandLine.Command;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to list the supported languages, their file extensions and extractors.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codepartition list
 * }</pre>
 */
@Command(
    name = "list",
    description = "List supported languages and file extensions",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Supported Languages:");
        System.out.println();
        for (Map.Entry<Language, EntityExtractor> entry : ExtractorRegistry.all().entrySet()) {
            Language language = entry.getKey();
            System.out.printf("  • %s (extractor: %s)%n", language.tag(), entry.getValue().getId());
            System.out.printf("    Extensions: %s%n", String.join(", ", language.extensions().stream()
                .map(extension -> "." + extension)
                .toList()));
        }
        return ExitCodes.SUCCESS;
    }
}
