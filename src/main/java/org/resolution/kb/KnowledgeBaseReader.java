package org.resolution.kb;

import org.resolution.antlr.ClauseSetBaseVisitor;
import org.resolution.antlr.ClauseSetParser.AtomContext;
import org.resolution.antlr.ClauseSetParser.ClauseContext;
import org.resolution.antlr.ClauseSetParser.ConstantContext;
import org.resolution.antlr.ClauseSetParser.DeclarationContext;
import org.resolution.antlr.ClauseSetParser.GoalContext;
import org.resolution.antlr.ClauseSetParser.LiteralContext;
import org.resolution.antlr.ClauseSetParser.NegativeContext;
import org.resolution.antlr.ClauseSetParser.NumberContext;
import org.resolution.antlr.ClauseSetParser.PositiveContext;
import org.resolution.antlr.ClauseSetParser.TermContext;
import org.resolution.antlr.ClauseSetParser.VariableContext;
import org.resolution.model.Clause;
import org.resolution.model.Constant;
import org.resolution.model.Literal;
import org.resolution.model.Signature;
import org.resolution.model.Term;
import org.resolution.model.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * LETTORE BASE DI CONOSCENZA - Visitor dall'albero sintattico ANTLR a clausole validate
 *
 * COSTRUTTI GESTITI:
 * • predicate p/n.        dichiarazione di arità
 * • { L1, ..., Ln }       clausola (separatori ',' oppure '|'); { } è la clausola vuota
 * • goal L1, ..., Ln.     goal congiuntivo, aggiunto come clausola { ¬L1, ..., ¬Ln }
 *
 * Ogni clausola viene validata contro la segnatura appena letta: un'arità
 * discordante interrompe il caricamento con
 * {@link org.resolution.model.MalformedClauseException}.
 *
 * La variabile anonima '_' riceve un nome distinto a ogni occorrenza.
 */
class KnowledgeBaseReader extends ClauseSetBaseVisitor<Void> {

    private static final Logger LOGGER = Logger.getLogger(KnowledgeBaseReader.class.getName());

    private static final String ANONYMOUS_VARIABLE = "_";

    /** '#' non è ammesso dal lexer: i nomi generati non collidono con quelli dell'utente */
    private static final String GENERATED_SEPARATOR = "#";

    private final Signature signature = new Signature();
    private final List<Clause> clauses = new ArrayList<>();
    private final List<Clause> goalClauses = new ArrayList<>();

    private final LiteralBuilder literalBuilder = new LiteralBuilder();
    private final TermBuilder termBuilder = new TermBuilder();

    private int anonymousCounter = 0;

    //region STATEMENT

    @Override
    public Void visitDeclaration(DeclarationContext ctx) {
        String predicate = ctx.symbol().getText();
        int arity;
        try {
            arity = Integer.parseInt(ctx.NUMBER().getText());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Arità non valida per " + predicate + ": " + ctx.NUMBER().getText(), e);
        }
        signature.declare(predicate, arity);
        return null;
    }

    @Override
    public Void visitClause(ClauseContext ctx) {
        List<Literal> literals = new ArrayList<>();
        for (LiteralContext literalCtx : ctx.literal()) {
            literals.add(literalBuilder.visit(literalCtx));
        }

        Clause clause = Clause.of(literals);
        signature.validate(clause);
        clauses.add(clause);

        LOGGER.finest("Clausola letta alla riga " + ctx.getStart().getLine() + ": " + clause);
        return null;
    }

    @Override
    public Void visitGoal(GoalContext ctx) {
        // ¬(L1 & ... & Ln) = ¬L1 | ... | ¬Ln
        List<Literal> negated = new ArrayList<>();
        for (LiteralContext literalCtx : ctx.literal()) {
            negated.add(literalBuilder.visit(literalCtx).negate());
        }

        Clause clause = Clause.of(negated);
        signature.validate(clause);
        clauses.add(clause);
        goalClauses.add(clause);

        LOGGER.fine("Goal negato: " + clause);
        return null;
    }

    //endregion

    //region RISULTATO

    KnowledgeBase toKnowledgeBase(String name) {
        return new KnowledgeBase(name, signature, clauses, goalClauses);
    }

    //endregion

    //region COSTRUZIONE LETTERALI E TERMINI

    private class LiteralBuilder extends ClauseSetBaseVisitor<Literal> {

        @Override
        public Literal visitPositive(PositiveContext ctx) {
            return buildLiteral(true, ctx.atom());
        }

        @Override
        public Literal visitNegative(NegativeContext ctx) {
            return buildLiteral(false, ctx.atom());
        }

        private Literal buildLiteral(boolean positive, AtomContext atom) {
            List<Term> arguments = new ArrayList<>();
            for (TermContext termCtx : atom.term()) {
                arguments.add(termBuilder.visit(termCtx));
            }
            return new Literal(positive, atom.symbol().getText(), arguments);
        }
    }

    private class TermBuilder extends ClauseSetBaseVisitor<Term> {

        @Override
        public Term visitVariable(VariableContext ctx) {
            String name = ctx.VARIABLE().getText();
            if (ANONYMOUS_VARIABLE.equals(name)) {
                name = ANONYMOUS_VARIABLE + GENERATED_SEPARATOR + (++anonymousCounter);
            }
            return new Variable(name);
        }

        @Override
        public Term visitConstant(ConstantContext ctx) {
            return new Constant(ctx.symbol().getText());
        }

        @Override
        public Term visitNumber(NumberContext ctx) {
            return new Constant(ctx.NUMBER().getText());
        }
    }

    //endregion
}
