package org.openscad.cst;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SimpleCstNodeTest {

    @Test
    void text_defaultsToConcatenatedChildren() {
        SimpleCstNode call = SimpleCstNode.named(CstTypes.MODULE_INSTANTIATION)
                .field("name", SimpleCstNode.leaf(CstTypes.IDENTIFIER, "cube"))
                .token("(")
                .child(SimpleCstNode.leaf(CstTypes.NUMBER, "10"))
                .token(")")
                .build();

        assertThat(call.text()).isEqualTo("cube(10)");
        assertThat(call.children()).hasSize(4);
        assertThat(call.namedChildren()).extracting(CstNode::type)
                .containsExactly(CstTypes.IDENTIFIER, CstTypes.NUMBER);
        assertThat(call.childForFieldName("name")).get().extracting(CstNode::text).isEqualTo("cube");
        assertThat(call.childForFieldName("body")).isEmpty();
    }

    @Test
    void hasError_propagatesFromDescendants() {
        SimpleCstNode broken = SimpleCstNode.named(CstTypes.STATEMENT)
                .child(SimpleCstNode.error().text("???").build())
                .build();

        assertThat(broken.isError()).isFalse();
        assertThat(broken.hasError()).isTrue();
        assertThat(broken.namedChild(0).type()).isEqualTo(CstTypes.ERROR);
    }

    @Test
    void tokens_areAnonymousAndTypedByText() {
        SimpleCstNode comma = SimpleCstNode.token(",");
        assertThat(comma.isNamed()).isFalse();
        assertThat(comma.type()).isEqualTo(",");
    }
}
