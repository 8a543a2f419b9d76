package com.codeontology.cli;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.orchestrator.BuilderKind;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to list what the pipeline accepts.
 *
 * <p>{@code builders} prints the entity builder ids understood by {@code --include},
 * {@code --exclude} and the {@code orchestrator} config section. {@code node-tags} prints the
 * syntax tree tags a JSON producer may emit, grouped by category.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * code-ontology list builders
 * code-ontology list node-tags
 * }</pre>
 */
@Command(
    name = "list",
    description = "List entity builders or syntax tree node tags",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(index = "0", description = "What to list: builders, node-tags", defaultValue = "builders")
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "builders", "builder" -> listBuilders();
            case "node-tags", "tags" -> listNodeTags();
            default -> {
                log.error("Unknown type: {}. Use: builders, node-tags", type);
                yield 1;
            }
        };
    }

    private int listBuilders() {
        System.out.println("Available Builders (entity phase):");
        System.out.println();
        for (BuilderKind kind : BuilderKind.values()) {
            System.out.printf("  • %s%n", kind.id());
        }
        System.out.println();
        System.out.println("The module entity, directives and attributes are always built.");
        return 0;
    }

    private int listNodeTags() {
        Map<NodeTag.Category, List<NodeTag>> byCategory = new EnumMap<>(NodeTag.Category.class);
        for (NodeTag tag : NodeTag.values()) {
            byCategory.computeIfAbsent(tag.category(), c -> new ArrayList<>()).add(tag);
        }
        System.out.println("Syntax Tree Node Tags:");
        byCategory.forEach((category, tags) -> {
            System.out.println();
            System.out.println("  " + category.name().toLowerCase() + ":");
            System.out.println("    " + tags.stream().map(NodeTag::name).collect(Collectors.joining(", ")));
        });
        return 0;
    }
}
