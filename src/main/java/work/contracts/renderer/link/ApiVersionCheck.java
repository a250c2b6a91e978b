package work.contracts.renderer.link;

import work.contracts.renderer.api.ErrorKind;
import work.contracts.renderer.api.RenderException;
import work.contracts.renderer.syntax.Expr;
import work.contracts.renderer.syntax.Stmt;

/**
 * Verifies that the template declares {@code api = "<major>.x.y"} with the supported major
 * version before anything else is linked.
 */
final class ApiVersionCheck {
    static final String API_FIELD = "api";

    private ApiVersionCheck() {
    }

    static void verify(SourceModule root, int supportedMajor) {
        var declared = declaredVersion(root);
        if (declared == null) {
            throw new RenderException(
                ErrorKind.VERSION_UNSUPPORTED,
                root.key().fileName() + " is missing api metadata. The renderer only supports contracts declaring "
                    + "api = \"" + supportedMajor + ".x.y\"",
                root.name(),
                null
            );
        }
        var major = declared.split("\\.", 2)[0].trim();
        if (!major.equals(Integer.toString(supportedMajor))) {
            throw new RenderException(
                ErrorKind.VERSION_UNSUPPORTED,
                "The renderer only supports api version " + supportedMajor + " contracts; "
                    + root.key().fileName() + " declares api = \"" + declared + "\". "
                    + "Please use an earlier renderer release for older contracts",
                root.name(),
                null
            );
        }
    }

    static String declaredVersion(SourceModule root) {
        for (var statement : root.body()) {
            Expr value = null;
            if (statement instanceof Stmt.Assign assign && assign.targets().stream().anyMatch(ApiVersionCheck::isApiName)) {
                value = assign.value();
            } else if (statement instanceof Stmt.AnnAssign assign && isApiName(assign.target())) {
                value = assign.value();
            }
            if (value instanceof Expr.Constant constant && constant.isString()) {
                return constant.value();
            }
        }
        return null;
    }

    private static boolean isApiName(Expr target) {
        return target instanceof Expr.Name name && name.id().equals(API_FIELD);
    }
}
