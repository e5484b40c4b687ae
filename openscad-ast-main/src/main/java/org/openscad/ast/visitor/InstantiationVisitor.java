package org.openscad.ast.visitor;

import java.util.Optional;
import java.util.Set;

import org.openscad.ast.node.AstNode;
import org.openscad.cst.CstNode;

/**
 * Base of the visitors that recognize calls of built-in modules by name.
 */
public abstract class InstantiationVisitor implements CstVisitor {

    private final Set<String> names;

    protected InstantiationVisitor(Set<String> names) {
        this.names = Set.copyOf(names);
    }

    public Set<String> getNames() {
        return names;
    }

    @Override
    public final VisitResult visit(CstNode node, VisitContext ctx) {
        if (!CstSupport.isInstantiation(node)) {
            return VisitResult.notApplicable();
        }
        Optional<String> name = CstSupport.calleeName(node).map(ctx::canonicalName);
        if (name.isEmpty() || !names.contains(name.get())) {
            return VisitResult.notApplicable();
        }
        return VisitResult.handled(lower(name.get(), node, ctx));
    }

    /**
     * Lowers a call of {@code name}, one of {@link #getNames()}.
     */
    protected abstract AstNode lower(String name, CstNode node, VisitContext ctx);
}
