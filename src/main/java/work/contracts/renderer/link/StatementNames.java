package work.contracts.renderer.link;

import work.contracts.renderer.syntax.Expr;
import work.contracts.renderer.syntax.Stmt;

/**
 * Names by which top-level statements are ordered and compared.
 */
final class StatementNames {

    private StatementNames() {
    }

    /** Name bound by a definition-like statement, or null. */
    static String definedName(Stmt statement) {
        if (statement instanceof Stmt.FunctionDef def) {
            return def.name();
        }
        if (statement instanceof Stmt.ClassDef cls) {
            return cls.name();
        }
        if (statement instanceof Stmt.Assign assign && assign.targets().get(0) instanceof Expr.Name name) {
            return name.id();
        }
        if (statement instanceof Stmt.AnnAssign assign && assign.target() instanceof Expr.Name name) {
            return name.id();
        }
        return null;
    }

    /**
     * Key used to place a statement in the metadata order: the assigned or defined name, the
     * module of a {@code from} import or the first module of a plain import.
     */
    static String orderingKey(Stmt statement) {
        if (statement instanceof Stmt.Assign assign) {
            return targetKey(assign.targets().get(0));
        }
        if (statement instanceof Stmt.AnnAssign assign) {
            return targetKey(assign.target());
        }
        if (statement instanceof Stmt.FunctionDef def) {
            return def.name();
        }
        if (statement instanceof Stmt.Import imp) {
            return imp.names().get(0).name();
        }
        if (statement instanceof Stmt.ImportFrom imp) {
            return imp.module();
        }
        return null;
    }

    private static String targetKey(Expr target) {
        if (target instanceof Expr.Name name) {
            return name.id();
        }
        if (target instanceof Expr.Attribute attribute) {
            return attribute.attr();
        }
        if (target instanceof Expr.Subscript subscript && subscript.value() instanceof Expr.Name name) {
            return name.id();
        }
        return null;
    }
}
