package sast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import com.google.common.base.Preconditions;

/** Drives an {@link ASTWalker} over a statement tree, writing replacements back in place. */
final class Traversal {
  private final ASTWalker walker;

  Traversal(ASTWalker walker) {
    this.walker = Preconditions.checkNotNull(walker);
  }

  Optional<Stmt> doIt(Stmt stmt) {
    ASTWalker.Action<Stmt> pre = walker.walkToStmtPre(stmt);
    if (pre.isStop()) return Optional.empty();

    Stmt node = pre.node();
    if (!pre.shouldDescend()) return Optional.of(node);
    if (!visitChildren(node)) return Optional.empty();

    return walker.walkToStmtPost(node);
  }

  private Optional<Expr> doIt(Expr expr) {
    return doLeaf(expr, walker::walkToExprPre, walker::walkToExprPost);
  }

  private Optional<Pattern> doIt(Pattern pattern) {
    return doLeaf(pattern, walker::walkToPatternPre, walker::walkToPatternPost);
  }

  private Optional<Decl> doIt(Decl decl) {
    return doLeaf(decl, walker::walkToDeclPre, walker::walkToDeclPost);
  }

  private static <T> Optional<T> doLeaf(
      T node, Function<T, ASTWalker.Action<T>> pre, Function<T, Optional<T>> post) {
    ASTWalker.Action<T> action = pre.apply(node);
    if (action.isStop()) return Optional.empty();
    if (!action.shouldDescend()) return Optional.of(action.node());

    return post.apply(action.node());
  }

  private Optional<StmtCondition> doIt(StmtCondition cond) {
    switch (cond.kind()) {
      case BINDING:
        {
          Optional<Decl> decl = doIt(cond.binding());
          if (!decl.isPresent()) return Optional.empty();
          if (decl.get() == cond.binding()) return Optional.of(cond);

          Preconditions.checkState(
              decl.get() instanceof PatternBindingDecl,
              "a condition binding can only be replaced by another pattern binding");
          return Optional.of(StmtCondition.binding((PatternBindingDecl) decl.get()));
        }
      case EXPRESSION:
        {
          Optional<Expr> expr = doIt(cond.expr());
          if (!expr.isPresent()) return Optional.empty();
          if (expr.get() == cond.expr()) return Optional.of(cond);
          return Optional.of(StmtCondition.expr(expr.get()));
        }
      default:
        throw new AssertionError(cond.kind());
    }
  }

  // Returns false if the walk was stopped.
  private boolean visitChildren(Stmt stmt) {
    switch (stmt.kind()) {
      case BRACE:
        return visitBrace(stmt.cast());
      case RETURN:
        return visitReturn(stmt.cast());
      case IF:
        return visitIf(stmt.cast());
      case IF_CONFIG:
        return visitIfConfig(stmt.cast());
      case WHILE:
        return visitWhile(stmt.cast());
      case DO_WHILE:
        return visitDoWhile(stmt.cast());
      case FOR:
        return visitFor(stmt.cast());
      case FOR_EACH:
        return visitForEach(stmt.cast());
      case SWITCH:
        return visitSwitch(stmt.cast());
      case CASE:
        return visitCase(stmt.cast());
      case BREAK:
      case CONTINUE:
      case FALLTHROUGH:
        return true;
      default:
        throw new AssertionError(stmt.kind());
    }
  }

  private boolean visitBrace(BraceStmt brace) {
    for (int i = 0; i < brace.numElements(); i++) {
      ASTElement element = brace.element(i);
      switch (element.kind()) {
        case STMT:
          {
            Optional<Stmt> stmt = doIt(element.stmt());
            if (!stmt.isPresent()) return false;
            if (stmt.get() != element.stmt()) brace.setElement(i, ASTElement.of(stmt.get()));
            break;
          }
        case EXPR:
          {
            Optional<Expr> expr = doIt(element.expr());
            if (!expr.isPresent()) return false;
            if (expr.get() != element.expr()) brace.setElement(i, ASTElement.of(expr.get()));
            break;
          }
        case DECL:
          {
            Optional<Decl> decl = doIt(element.decl());
            if (!decl.isPresent()) return false;
            if (decl.get() != element.decl()) brace.setElement(i, ASTElement.of(decl.get()));
            break;
          }
        default:
          throw new AssertionError(element.kind());
      }
    }
    return true;
  }

  private boolean visitReturn(ReturnStmt ret) {
    if (!ret.hasResult()) return true;

    Optional<Expr> result = doIt(ret.result());
    if (!result.isPresent()) return false;
    if (result.get() != ret.result()) ret.setResult(result.get());
    return true;
  }

  private boolean visitIf(IfStmt ifStmt) {
    Optional<StmtCondition> cond = doIt(ifStmt.cond());
    if (!cond.isPresent()) return false;
    if (cond.get() != ifStmt.cond()) ifStmt.setCond(cond.get());

    Optional<Stmt> thenStmt = doIt(ifStmt.thenStmt());
    if (!thenStmt.isPresent()) return false;
    if (thenStmt.get() != ifStmt.thenStmt()) ifStmt.setThenStmt(thenStmt.get());

    if (ifStmt.elseStmt().isPresent()) {
      Optional<Stmt> elseStmt = doIt(ifStmt.elseStmt().get());
      if (!elseStmt.isPresent()) return false;
      if (elseStmt.get() != ifStmt.elseStmt().get()) ifStmt.setElseStmt(elseStmt.get());
    }
    return true;
  }

  private boolean visitIfConfig(IfConfigStmt ifConfig) {
    Optional<Expr> cond = doIt(ifConfig.cond());
    if (!cond.isPresent()) return false;
    if (cond.get() != ifConfig.cond()) ifConfig.setCond(cond.get());

    Optional<Stmt> thenStmt = doIt(ifConfig.thenStmt());
    if (!thenStmt.isPresent()) return false;
    if (thenStmt.get() != ifConfig.thenStmt()) ifConfig.setThenStmt(thenStmt.get());

    if (ifConfig.elseStmt().isPresent()) {
      Optional<Stmt> elseStmt = doIt(ifConfig.elseStmt().get());
      if (!elseStmt.isPresent()) return false;
      if (elseStmt.get() != ifConfig.elseStmt().get()) ifConfig.setElseStmt(elseStmt.get());
    }
    return true;
  }

  private boolean visitWhile(WhileStmt whileStmt) {
    Optional<StmtCondition> cond = doIt(whileStmt.cond());
    if (!cond.isPresent()) return false;
    if (cond.get() != whileStmt.cond()) whileStmt.setCond(cond.get());

    Optional<Stmt> body = doIt(whileStmt.body());
    if (!body.isPresent()) return false;
    if (body.get() != whileStmt.body()) whileStmt.setBody(body.get());
    return true;
  }

  private boolean visitDoWhile(DoWhileStmt doWhile) {
    Optional<Stmt> body = doIt(doWhile.body());
    if (!body.isPresent()) return false;
    if (body.get() != doWhile.body()) doWhile.setBody(body.get());

    Optional<Expr> cond = doIt(doWhile.cond());
    if (!cond.isPresent()) return false;
    if (cond.get() != doWhile.cond()) doWhile.setCond(cond.get());
    return true;
  }

  private boolean visitFor(ForStmt forStmt) {
    if (forStmt.initializer().isPresent()) {
      Optional<Expr> initializer = doIt(forStmt.initializer().get());
      if (!initializer.isPresent()) return false;
      if (initializer.get() != forStmt.initializer().get()) {
        forStmt.setInitializer(initializer.get());
      }
    }

    List<Decl> decls = new ArrayList<>();
    boolean declsChanged = false;
    for (Decl decl : forStmt.initializerVarDecls()) {
      Optional<Decl> visited = doIt(decl);
      if (!visited.isPresent()) return false;
      declsChanged |= visited.get() != decl;
      decls.add(visited.get());
    }
    if (declsChanged) forStmt.setInitializerVarDecls(decls);

    if (forStmt.cond().isPresent()) {
      Optional<Expr> cond = doIt(forStmt.cond().get());
      if (!cond.isPresent()) return false;
      if (cond.get() != forStmt.cond().get()) forStmt.setCond(cond);
    }

    if (forStmt.increment().isPresent()) {
      Optional<Expr> increment = doIt(forStmt.increment().get());
      if (!increment.isPresent()) return false;
      if (increment.get() != forStmt.increment().get()) forStmt.setIncrement(increment.get());
    }

    Optional<Stmt> body = doIt(forStmt.body());
    if (!body.isPresent()) return false;
    if (body.get() != forStmt.body()) forStmt.setBody(body.get());
    return true;
  }

  private boolean visitForEach(ForEachStmt forEach) {
    Optional<Pattern> pattern = doIt(forEach.pattern());
    if (!pattern.isPresent()) return false;
    if (pattern.get() != forEach.pattern()) forEach.setPattern(pattern.get());

    Optional<Expr> sequence = doIt(forEach.sequence());
    if (!sequence.isPresent()) return false;
    if (sequence.get() != forEach.sequence()) forEach.setSequence(sequence.get());

    Optional<Stmt> body = doIt(forEach.body());
    if (!body.isPresent()) return false;
    Preconditions.checkState(
        body.get().kind() == Stmt.Kind.BRACE, "for-each body must remain a brace statement");
    if (body.get() != forEach.body()) forEach.setBody(body.get().cast());
    return true;
  }

  private boolean visitSwitch(SwitchStmt switchStmt) {
    Optional<Expr> subject = doIt(switchStmt.subjectExpr());
    if (!subject.isPresent()) return false;
    if (subject.get() != switchStmt.subjectExpr()) switchStmt.setSubjectExpr(subject.get());

    for (CaseStmt caseStmt : switchStmt.cases()) {
      Optional<Stmt> visited = doIt(caseStmt);
      if (!visited.isPresent()) return false;
      Preconditions.checkState(visited.get() == caseStmt, "switch case remap not supported");
    }
    return true;
  }

  private boolean visitCase(CaseStmt caseStmt) {
    for (CaseLabelItem item : caseStmt.mutableCaseLabelItems()) {
      Optional<Pattern> pattern = doIt(item.pattern());
      if (!pattern.isPresent()) return false;
      if (pattern.get() != item.pattern()) item.setPattern(pattern.get());

      if (item.guardExpr().isPresent()) {
        Optional<Expr> guard = doIt(item.guardExpr().get());
        if (!guard.isPresent()) return false;
        if (guard.get() != item.guardExpr().get()) item.setGuardExpr(guard.get());
      }
    }

    Optional<Stmt> body = doIt(caseStmt.body());
    if (!body.isPresent()) return false;
    if (body.get() != caseStmt.body()) caseStmt.setBody(body.get());
    return true;
  }
}
