package com.docforge.core.inference;

import com.docforge.core.parser.AstWalker;
import com.docforge.core.parser.PythonAst.BoolOp;
import com.docforge.core.parser.PythonAst.ComprehensionClause;
import com.docforge.core.parser.PythonAst.ExceptHandler;
import com.docforge.core.parser.PythonAst.For;
import com.docforge.core.parser.PythonAst.If;
import com.docforge.core.parser.PythonAst.IfExp;
import com.docforge.core.parser.PythonAst.MatchCase;
import com.docforge.core.parser.PythonAst.Stmt;
import com.docforge.core.parser.PythonAst.While;

import java.util.List;

/**
 * McCabe cyclomatic complexity over the syntax tree.
 *
 * <p>One for entry, plus one per {@code if}/{@code elif}, conditional expression, loop,
 * comprehension {@code for} and {@code if} clause, {@code except} clause and {@code case}
 * clause, plus one per extra operand of {@code and}/{@code or}. Nested scopes are not counted.
 */
public class ComplexityCalculator {

    public int complexity(List<Stmt> body) {
        int[] score = {1};
        AstWalker.walkScope(body, node -> {
            if (node instanceof If || node instanceof IfExp || node instanceof For || node instanceof While
                || node instanceof ExceptHandler || node instanceof MatchCase) {
                score[0]++;
            } else if (node instanceof ComprehensionClause clause) {
                score[0] += 1 + clause.conditions().size();
            } else if (node instanceof BoolOp bool) {
                score[0] += bool.values().size() - 1;
            }
            return true;
        });
        return score[0];
    }
}
