package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.model.FunctionSpecInfo;
import com.codeontology.core.model.SpecKind;
import com.codeontology.core.model.TypeDefinitionInfo;
import com.codeontology.core.model.TypeExpression;
import com.codeontology.core.model.TypeExpressionKind;
import com.codeontology.core.model.TypeVisibility;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static com.codeontology.core.ast.SyntaxNodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TypeSpecExtractor}.
 */
class TypeSpecExtractorTest {

    private final TypeSpecExtractor extractor = new TypeSpecExtractor();

    @Test
    void types_publicPrivateAndOpaque_mapVisibility() {
        List<SyntaxNode> statements = List.of(
            attribute("type", op("::", call("id"), call("integer"))),
            attribute("typep", op("::", call("state"), call("map"))),
            attribute("opaque", op("::", call("token"), call("binary"))));

        List<TypeDefinitionInfo> types = extractor.types(statements);

        assertThat(types).extracting(TypeDefinitionInfo::name, TypeDefinitionInfo::visibility).containsExactly(
            tuple("id", TypeVisibility.PUBLIC),
            tuple("state", TypeVisibility.PRIVATE),
            tuple("token", TypeVisibility.OPAQUE));
        assertThat(types.get(0).expression().kind()).isEqualTo(TypeExpressionKind.BASIC);
        assertThat(types.get(0).expression().name()).isEqualTo("integer");
    }

    @Test
    void types_parameterizedType_recordsParameters() {
        SyntaxNode definition = attribute("type",
            op("::", call("result", var("ok"), var("err")),
                op("|", node(NodeTag.TUPLE, atom("ok"), var("ok")), node(NodeTag.TUPLE, atom("error"), var("err")))));

        TypeDefinitionInfo type = extractor.types(List.of(definition)).get(0);

        assertThat(type.arity()).isEqualTo(2);
        assertThat(type.parameters()).containsExactly("ok", "err");
        assertThat(type.expression().kind()).isEqualTo(TypeExpressionKind.UNION);
        assertThat(type.expression().elements()).extracting(TypeExpression::kind)
            .containsExactly(TypeExpressionKind.TUPLE, TypeExpressionKind.TUPLE);
    }

    @Test
    void types_malformedDefinition_isSkipped() {
        assertThat(extractor.types(List.of(attribute("type", call("broken"))))).isEmpty();
    }

    @Test
    void specs_functionSpec_parsesParameterAndReturnTypes() {
        SyntaxNode spec = at(attribute("spec",
            op("::", call("fetch", remoteCall("String", "t"), call("keyword")),
                op("|", node(NodeTag.TUPLE, atom("ok"), call("term")), atom("error")))), 8);

        FunctionSpecInfo info = extractor.specs(List.of(spec)).get(0);

        assertThat(info.kind()).isEqualTo(SpecKind.SPEC);
        assertThat(info.signature().name()).isEqualTo("fetch");
        assertThat(info.arity()).isEqualTo(2);
        assertThat(info.parameterTypes().get(0).kind()).isEqualTo(TypeExpressionKind.REMOTE);
        assertThat(info.parameterTypes().get(0).module()).isEqualTo("String");
        assertThat(info.parameterTypes().get(0).name()).isEqualTo("t");
        assertThat(info.returnType().kind()).isEqualTo(TypeExpressionKind.UNION);
        assertThat(info.location().startLine()).isEqualTo(8);
    }

    @Test
    void specs_whenClause_collectsTypeVariables() {
        SyntaxNode spec = attribute("spec", op("when",
            op("::", call("identity", var("a")), var("a")),
            node(NodeTag.LIST, kw("a", call("term")))));

        FunctionSpecInfo info = extractor.specs(List.of(spec)).get(0);

        assertThat(info.typeVariables()).containsExactly("a");
        assertThat(info.returnType().kind()).isEqualTo(TypeExpressionKind.VARIABLE);
    }

    @Test
    void specs_optionalCallback_isFlagged() {
        List<SyntaxNode> statements = List.of(
            attribute("callback", op("::", call("init", call("term")), call("term"))),
            attribute("macrocallback", op("::", call("expand", call("term")), call("term"))),
            attribute("optional_callbacks", node(NodeTag.LIST, kw("init", integer(1)))));

        List<FunctionSpecInfo> specs = extractor.specs(statements);

        assertThat(specs).extracting(FunctionSpecInfo::name, FunctionSpecInfo::kind, FunctionSpecInfo::optional)
            .containsExactly(
                tuple("init", SpecKind.CALLBACK, true),
                tuple("expand", SpecKind.MACROCALLBACK, false));
    }

    @Test
    void specs_optionalCallbackWithOversizedArity_isSkipped() {
        List<SyntaxNode> statements = List.of(
            attribute("callback", op("::", call("init", call("term")), call("term"))),
            attribute("optional_callbacks", node(NodeTag.LIST,
                kw("init", literal(NodeTag.INTEGER, new BigInteger("99999999999999999999"))))));

        List<FunctionSpecInfo> specs = extractor.specs(statements);

        assertThat(specs).extracting(FunctionSpecInfo::name, FunctionSpecInfo::optional)
            .containsExactly(tuple("init", false));
    }

    @Test
    void parseType_functionAndListAndMap_buildStructuredExpressions() {
        TypeExpression fun = extractor.parseType(op("->", node(NodeTag.LIST, call("integer")), call("atom")));
        TypeExpression list = extractor.parseType(call("list", call("binary")));
        TypeExpression map = extractor.parseType(node(NodeTag.MAP, kw("name", remoteCall("String", "t"))));

        assertThat(fun.kind()).isEqualTo(TypeExpressionKind.FUNCTION);
        assertThat(fun.elements()).hasSize(2);
        assertThat(list.kind()).isEqualTo(TypeExpressionKind.LIST);
        assertThat(list.elements()).singleElement().extracting(TypeExpression::name).isEqualTo("binary");
        assertThat(map.kind()).isEqualTo(TypeExpressionKind.MAP);
        assertThat(map.elements()).extracting(TypeExpression::kind)
            .containsExactly(TypeExpressionKind.LITERAL, TypeExpressionKind.REMOTE);
    }

    @Test
    void parseType_literalsAndRanges_areLiteral() {
        assertThat(extractor.parseType(atom("ok")).kind()).isEqualTo(TypeExpressionKind.LITERAL);
        TypeExpression range = extractor.parseType(op("..", integer(1), integer(10)));
        assertThat(range.kind()).isEqualTo(TypeExpressionKind.LITERAL);
        assertThat(range.text()).isEqualTo("1 .. 10");
    }
}
