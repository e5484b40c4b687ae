package org.openscad.cst.antlr4;

import org.junit.jupiter.api.Test;
import org.openscad.OpenScadException;
import org.openscad.SourceParseException;
import org.openscad.cst.CstNode;
import org.openscad.cst.CstPoint;
import org.openscad.cst.CstTypes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Antlr4ScadParserTest {

    private static CstNode firstStatement(String source) {
        CstParseResult result = Antlr4ScadParser.parse(source);
        assertThat(result.problems()).isEmpty();
        CstNode statement = result.root().namedChild(0);
        assertThat(statement.type()).isEqualTo(CstTypes.STATEMENT);
        return statement.namedChild(0);
    }

    @Test
    void moduleInstantiation_exposesNameAndArgumentFields() {
        CstNode call = firstStatement("cube(10);");

        assertThat(call.type()).isEqualTo(CstTypes.MODULE_INSTANTIATION);
        assertThat(call.childForFieldName("name")).get().extracting(CstNode::text).isEqualTo("cube");

        CstNode arguments = call.childForFieldName("arguments").orElseThrow();
        assertThat(arguments.type()).isEqualTo(CstTypes.ARGUMENT_LIST);
        assertThat(arguments.children()).extracting(CstNode::type)
                .containsExactly("(", CstTypes.ARGUMENT, ")");

        CstNode value = arguments.namedChild(0).childForFieldName("value").orElseThrow();
        assertThat(value.type()).isEqualTo(CstTypes.PRIMARY_EXPRESSION);
        assertThat(value.namedChild(0).type()).isEqualTo(CstTypes.NUMBER);
        assertThat(value.namedChild(0).text()).isEqualTo("10");
    }

    @Test
    void ruleText_keepsOriginalWhitespace() {
        CstNode call = firstStatement("cube( 10 ,center = true );");
        assertThat(call.text()).isEqualTo("cube( 10 ,center = true );");
    }

    @Test
    void positions_areZeroBasedWithCharacterOffsets() {
        CstParseResult result = Antlr4ScadParser.parse("// header\ncube(10);");
        CstNode call = result.root().namedChild(0).namedChild(0);

        assertThat(call.startPoint()).isEqualTo(new CstPoint(1, 0, 10));
        assertThat(call.endPoint()).isEqualTo(new CstPoint(1, 9, 19));
    }

    @Test
    void binaryExpression_respectsPrecedence() {
        CstNode assignment = firstStatement("x = 1 + 2 * 3;");
        assertThat(assignment.type()).isEqualTo(CstTypes.ASSIGNMENT_STATEMENT);

        CstNode sum = assignment.childForFieldName("value").orElseThrow();
        assertThat(sum.type()).isEqualTo(CstTypes.BINARY_EXPRESSION);
        assertThat(sum.childForFieldName("operator")).get().extracting(CstNode::text).isEqualTo("+");

        CstNode product = sum.childForFieldName("right").orElseThrow();
        assertThat(product.type()).isEqualTo(CstTypes.BINARY_EXPRESSION);
        assertThat(product.childForFieldName("operator")).get().extracting(CstNode::text).isEqualTo("*");
    }

    @Test
    void rangeAndVector_areDistinguished() {
        CstNode range = firstStatement("r = [0:2:10];").childForFieldName("value").orElseThrow();
        assertThat(range.type()).isEqualTo(CstTypes.RANGE_EXPRESSION);
        assertThat(range.childForFieldName("step")).get().extracting(CstNode::text).isEqualTo("2");

        CstNode vector = firstStatement("v = [0, 2, 10];").childForFieldName("value").orElseThrow();
        assertThat(vector.type()).isEqualTo(CstTypes.VECTOR_EXPRESSION);
        assertThat(vector.namedChildCount()).isEqualTo(3);
    }

    @Test
    void elseIf_nestsIfStatementInAlternative() {
        CstNode ifStatement = firstStatement("if (a) cube(1); else if (b) sphere(1); else cylinder(h=1);");
        assertThat(ifStatement.type()).isEqualTo(CstTypes.IF_STATEMENT);

        CstNode alternative = ifStatement.childForFieldName("alternative").orElseThrow();
        assertThat(alternative.namedChild(0).type()).isEqualTo(CstTypes.IF_STATEMENT);
    }

    @Test
    void includePath_isASingleToken() {
        CstNode include = firstStatement("include <lib/gears.scad>");
        assertThat(include.type()).isEqualTo(CstTypes.INCLUDE_STATEMENT);
        assertThat(include.children()).hasSize(1);
        assertThat(include.children().get(0).text()).isEqualTo("include <lib/gears.scad>");
    }

    @Test
    void comments_areNotPartOfTheTree() {
        CstParseResult result = Antlr4ScadParser.parse("/* a */ cube(1); // b\n");
        assertThat(result.root().namedChildren()).hasSize(1);
    }

    @Test
    void syntaxError_isCollectedAndMarkedInTree() {
        CstParseResult result = Antlr4ScadParser.parse("cube(10;\nsphere(2);");

        assertThat(result.hasProblems()).isTrue();
        assertThat(result.problems().get(0).line()).isEqualTo(1);
        assertThat(result.root().hasError()).isTrue();
    }

    @Test
    void parseStrict_throwsWithPosition() {
        String bad = "cube(10;";
        assertThatThrownBy(() -> Antlr4ScadParser.parseStrict(bad))
            .isInstanceOf(SourceParseException.class)
            .isInstanceOf(OpenScadException.class)
            .satisfies(e -> {
                SourceParseException pe = (SourceParseException) e;
                assertThat(pe.getSource()).isEqualTo(bad);
                assertThat(pe.getLine()).isEqualTo(1);
                assertThat(pe.getMessage()).contains("Parse error");
            });
    }

    @Test
    void expressionStart_parsesBareExpression() {
        CstParseResult result = Antlr4ScadParser.parse("a ? b : c", Antlr4ParseStart.EXPRESSION);
        assertThat(result.problems()).isEmpty();
        assertThat(result.root().type()).isEqualTo(CstTypes.CONDITIONAL_EXPRESSION);
    }
}
