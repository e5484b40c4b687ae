package org.openscad.ast.visitor;

import org.junit.jupiter.api.Test;
import org.openscad.ast.AstGenerator;
import org.openscad.ast.GenerationResult;
import org.openscad.ast.diagnostics.Severity;
import org.openscad.ast.node.BinaryExpressionNode;
import org.openscad.ast.node.CubeNode;
import org.openscad.ast.node.FunctionDefinitionNode;
import org.openscad.ast.node.LiteralNode;
import org.openscad.ast.node.ModuleDefinitionNode;
import org.openscad.ast.node.ParameterDeclaration;
import org.openscad.ast.node.TranslateNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.openscad.ast.CstFixtures.program;

class DefinitionVisitorTest {

    @Test
    void moduleDefinition_withDefaultsAndBody() {
        GenerationResult result = new AstGenerator().generate(program(
                "module box(size = 10, center) { translate([1, 0, 0]) cube(size, center = center); }"));

        ModuleDefinitionNode module = (ModuleDefinitionNode) result.statements().get(0);
        assertThat(module.name()).isEqualTo("box");
        assertThat(module.parameters()).extracting(ParameterDeclaration::name).containsExactly("size", "center");
        assertThat(((LiteralNode) module.parameters().get(0).defaultValue()).value()).isEqualTo(10.0);
        assertThat(module.parameters().get(1).defaultValue()).isNull();
        assertThat(module.body()).singleElement().isInstanceOfSatisfying(TranslateNode.class,
                translate -> assertThat(translate.children()).singleElement().isInstanceOf(CubeNode.class));
        // size and center are parameters, not literals
        assertThat(result.diagnostics(Severity.WARNING)).isNotEmpty();
        assertThat(result.hasErrors()).isFalse();
    }

    @Test
    void moduleDefinition_withSingleStatementBody() {
        ModuleDefinitionNode module = (ModuleDefinitionNode) new AstGenerator()
                .generate(program("module dot() cube(1);")).statements().get(0);

        assertThat(module.parameters()).isEmpty();
        assertThat(module.body()).singleElement().isInstanceOf(CubeNode.class);
    }

    @Test
    void functionDefinition() {
        FunctionDefinitionNode function = (FunctionDefinitionNode) new AstGenerator()
                .generate(program("function area(r, $fn = 8) = PI * r * r;")).statements().get(0);

        assertThat(function.name()).isEqualTo("area");
        assertThat(function.parameters()).extracting(ParameterDeclaration::name).containsExactly("r", "$fn");
        assertThat(function.expression()).isInstanceOf(BinaryExpressionNode.class);
    }
}
