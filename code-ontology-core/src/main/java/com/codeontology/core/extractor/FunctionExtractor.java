package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.model.ClauseInfo;
import com.codeontology.core.model.DelegateTarget;
import com.codeontology.core.model.FunctionForm;
import com.codeontology.core.model.FunctionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts named functions, macros, guards and delegates from a module body.
 *
 * <p>Definitions sharing name and arity form one function whose clauses keep source order.
 * A {@code @doc} (or {@code @doc false}) applies to the next definition that starts a new
 * function.
 */
public class FunctionExtractor {

    private static final Logger log = LoggerFactory.getLogger(FunctionExtractor.class);

    /**
     * Extracts functions in order of first definition.
     *
     * @param statements module body statements
     * @param scope module scope used to resolve delegate targets
     * @return functions
     */
    public List<FunctionInfo> extract(List<SyntaxNode> statements, ExtractionScope scope) {
        Map<String, Accumulator> functions = new LinkedHashMap<>();
        String pendingDoc = null;
        boolean pendingDocFalse = false;

        for (SyntaxNode statement : statements) {
            if (AttributeExtractor.isDefinition(statement, "doc")) {
                pendingDoc = AttributeExtractor.docText(statement).orElse(null);
                pendingDocFalse = AttributeExtractor.isDocFalse(statement);
                continue;
            }
            if (!statement.is(NodeTag.FUNCTION_DEF)) {
                continue;
            }
            Optional<FunctionForm> form = FunctionForm.fromKeyword(statement.textValue());
            if (form.isEmpty() || statement.name() == null) {
                log.debug("Skipping function definition with form {} at {}", statement.value(), statement.location());
                continue;
            }
            List<SyntaxNode> params = statement.keywordValues("params");
            String key = statement.name() + "/" + params.size();
            Accumulator accumulator = functions.get(key);
            if (accumulator == null) {
                accumulator = new Accumulator(statement, form.get(), pendingDoc, pendingDocFalse);
                functions.put(key, accumulator);
                pendingDoc = null;
                pendingDocFalse = false;
            }
            accumulator.add(statement, params);
        }

        List<FunctionInfo> result = new ArrayList<>(functions.size());
        for (Accumulator accumulator : functions.values()) {
            result.add(accumulator.toInfo(scope));
        }
        return result;
    }

    private static final class Accumulator {
        private final SyntaxNode first;
        private final FunctionForm form;
        private final String doc;
        private final boolean docFalse;
        private final List<ClauseInfo> clauses = new ArrayList<>();
        private SyntaxNode last;
        private int defaults;

        Accumulator(SyntaxNode first, FunctionForm form, String doc, boolean docFalse) {
            this.first = first;
            this.form = form;
            this.doc = doc;
            this.docFalse = docFalse;
        }

        void add(SyntaxNode definition, List<SyntaxNode> params) {
            clauses.add(new ClauseInfo(
                clauses.size(),
                PatternAnalyzer.parameters(params),
                definition.keywordValue("when").orElse(null),
                definition.keywordValue("do").orElse(null),
                definition.location()));
            defaults = Math.max(defaults, PatternAnalyzer.defaultCount(params));
            last = definition;
        }

        FunctionInfo toInfo(ExtractionScope scope) {
            int arity = first.keywordValues("params").size();
            String name = first.name();
            DelegateTarget delegate = null;
            if (form == FunctionForm.DELEGATE) {
                Optional<String> target = first.keywordValue("to").flatMap(scope::resolveModule);
                String targetName = first.keywordValue("as")
                    .map(SyntaxNode::textValue)
                    .orElse(name);
                if (target.isPresent()) {
                    delegate = new DelegateTarget(target.get(), targetName, arity);
                } else {
                    log.debug("defdelegate {}/{} without resolvable to: target", name, arity);
                }
            }
            return new FunctionInfo(
                scope.module(),
                name,
                arity,
                arity - defaults,
                form,
                FunctionForm.visibilityOf(first.textValue()),
                doc,
                docFalse,
                delegate,
                clauses,
                span(first.location(), last.location()));
        }

        private static SourceLocation span(SourceLocation start, SourceLocation end) {
            if (start == null) {
                return end;
            }
            if (end == null) {
                return start;
            }
            return SourceLocation.of(start.startLine(), Math.max(start.endLine(), end.endLine()));
        }
    }
}
