package sast;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.CaseFormat;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.errorprone.annotations.ForOverride;

/**
 * Renders a statement tree as an indented s-expression, e.g.
 *
 * <pre>
 * (if_stmt
 *   cond
 *   (brace_stmt
 *     (return_stmt
 *       one)))
 * </pre>
 *
 * For developers only: the format may change and must not appear in diagnostics.
 */
public final class StmtPrinter {

  @AutoValue
  public abstract static class Options {
    /** Spaces per nesting level. */
    public abstract int indent();

    public abstract boolean printSourceRanges();

    public abstract boolean markImplicit();

    public static Builder builder() {
      return new AutoValue_StmtPrinter_Options.Builder()
          .setIndent(2)
          .setPrintSourceRanges(false)
          .setMarkImplicit(true);
    }

    public static Options defaults() {
      return builder().build();
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setIndent(int indent);

      public abstract Builder setPrintSourceRanges(boolean printSourceRanges);

      public abstract Builder setMarkImplicit(boolean markImplicit);

      @ForOverride
      abstract Options autoBuild();

      public final Options build() {
        Options options = autoBuild();
        Preconditions.checkArgument(options.indent() >= 0, "negative indent");
        return options;
      }
    }
  }

  private final Options options;

  public StmtPrinter(Options options) {
    this.options = Preconditions.checkNotNull(options);
  }

  public String print(Stmt root) {
    StringBuilder out = new StringBuilder();
    root.walk(new PrintWalker(out));
    return out.toString();
  }

  /** {@code "DoWhile"} becomes {@code "do_while_stmt"}. */
  static String sexpName(Stmt.Kind kind) {
    return CaseFormat.UPPER_CAMEL.to(CaseFormat.LOWER_UNDERSCORE, Stmt.kindName(kind)) + "_stmt";
  }

  private final class PrintWalker extends ASTWalker {
    private final StringBuilder out;
    private int depth = 0;

    private PrintWalker(StringBuilder out) {
      this.out = out;
    }

    private void newLine() {
      if (out.length() > 0) out.append('\n');
      out.append(Strings.repeat(" ", depth * options.indent()));
    }

    private <T> Action<T> leaf(T node) {
      newLine();
      out.append(node);
      return Action.skipChildren(node);
    }

    @Override
    public Action<Stmt> walkToStmtPre(Stmt stmt) {
      newLine();
      out.append('(').append(sexpName(stmt.kind()));
      appendAttributes(stmt);
      if (options.markImplicit() && stmt.isImplicit()) out.append(" implicit");
      if (options.printSourceRanges()) out.append(' ').append(stmt.sourceRange());

      depth++;
      return Action.proceed(stmt);
    }

    @Override
    public Optional<Stmt> walkToStmtPost(Stmt stmt) {
      depth--;
      out.append(')');
      return Optional.of(stmt);
    }

    @Override
    public Action<Expr> walkToExprPre(Expr expr) {
      return leaf(expr);
    }

    @Override
    public Action<Pattern> walkToPatternPre(Pattern pattern) {
      return leaf(pattern);
    }

    @Override
    public Action<Decl> walkToDeclPre(Decl decl) {
      return leaf(decl);
    }

    private void appendAttributes(Stmt stmt) {
      if (Stmt.isLabeledStatement(stmt.kind())) {
        LabeledStmtInfo label = LabeledStmt.from(stmt).labelInfo();
        if (label.isPresent()) out.append(" label=").append(label.name());
      }

      switch (stmt.kind()) {
        case BRACE:
          {
            BraceStmt brace = stmt.cast();
            if (brace.isConfigBlock()) out.append(" config");
            if (brace.isInactiveConfigBlock()) out.append(" inactive");
            break;
          }
        case IF_CONFIG:
          {
            IfConfigStmt ifConfig = stmt.cast();
            out.append(ifConfig.isIfBlockActive() ? " active=then" : " active=else");
            break;
          }
        case CASE:
          {
            CaseStmt caseStmt = stmt.cast();
            if (caseStmt.isDefault()) out.append(" default");
            if (caseStmt.hasBoundDecls()) out.append(" bound_decls");
            break;
          }
        case BREAK:
        case CONTINUE:
          {
            JumpStmt jump = stmt.cast();
            if (jump.hasTargetName()) out.append(" target=").append(jump.targetName());
            break;
          }
        default:
          break;
      }
    }
  }
}
