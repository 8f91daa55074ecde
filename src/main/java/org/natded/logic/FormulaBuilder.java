package org.natded.logic;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.natded.antlr.LogicFormulaBaseVisitor;
import org.natded.antlr.LogicFormulaParser.AndContext;
import org.natded.antlr.LogicFormulaParser.FormulaContext;
import org.natded.antlr.LogicFormulaParser.IdContext;
import org.natded.antlr.LogicFormulaParser.ImpliesContext;
import org.natded.antlr.LogicFormulaParser.NotContext;
import org.natded.antlr.LogicFormulaParser.OrContext;
import org.natded.antlr.LogicFormulaParser.ParContext;
import org.natded.antlr.LogicFormulaParser.VarContext;

import java.util.List;
import java.util.logging.Logger;

/**
 * COSTRUTTORE DI FORMULE - Convertitore da albero sintattico ANTLR a {@link Formula}
 *
 * Implementa un visitor sull'albero prodotto dalla grammatica LogicFormula,
 * costruendo la formula dal basso verso l'alto.
 *
 * OPERATORI (in ordine di precedenza crescente):
 * - Implicazione (to, \to, →): associativa a destra, A → B → C ~ A → (B → C)
 * - Disgiunzione (or, \lor, ∨): al più un operatore per livello
 * - Congiunzione (and, \land, ∧): al più un operatore per livello
 * - Negazione (not, \lnot, ¬): unaria, precedenza massima
 *
 * CATENE AMBIGUE:
 * La grammatica accetta A and B and C per poter segnalare l'errore in modo
 * preciso: il visitor registra la prima catena ambigua incontrata e
 * {@link #build(FormulaContext)} la converte in {@link ParseError}.
 *
 * Un'istanza serve una sola conversione.
 */
public class FormulaBuilder extends LogicFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaBuilder.class.getName());

    /** Primo operatore che rende ambigua una catena, null se nessuno */
    private Token ambiguousOperator;

    //region PUNTO DI INGRESSO

    /**
     * Converte l'albero sintattico completo in una formula.
     *
     * @param tree radice prodotta da {@code LogicFormulaParser.formula()}
     * @return formula costruita
     * @throws ParseError se l'albero contiene una catena and/or senza parentesi
     */
    public Formula build(FormulaContext tree) throws ParseError {
        ambiguousOperator = null;
        Formula formula = visit(tree);

        if (ambiguousOperator != null) {
            throw new ParseError(ParseError.Kind.AMBIGUOUS_CHAIN,
                    ambiguousOperator.getStartIndex(), ambiguousOperator.getText());
        }

        LOGGER.fine("Formula costruita: " + formula);
        return formula;
    }

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        return visit(ctx.implication());
    }

    //endregion

    //region CONNETTIVI BINARI

    /**
     * Implicazione: il conseguente è a sua volta una implicazione, quindi la
     * ricorsione realizza l'associatività a destra.
     */
    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        Formula antecedent = visit(ctx.disjunction());
        if (ctx.IMPLIES() == null) {
            return antecedent;
        }
        return Formula.to(antecedent, visit(ctx.implication()));
    }

    @Override
    public Formula visitOr(OrContext ctx) {
        if (ctx.conjunction().size() == 1) {
            return visit(ctx.conjunction(0));
        }

        LOGGER.finest("Elaborazione disgiunzione con " + ctx.conjunction().size() + " operandi");
        recordAmbiguity(ctx.OR());

        Formula result = visit(ctx.conjunction(0));
        for (int i = 1; i < ctx.conjunction().size(); i++) {
            result = Formula.or(result, visit(ctx.conjunction(i)));
        }
        return result;
    }

    @Override
    public Formula visitAnd(AndContext ctx) {
        if (ctx.negation().size() == 1) {
            return visit(ctx.negation(0));
        }

        LOGGER.finest("Elaborazione congiunzione con " + ctx.negation().size() + " operandi");
        recordAmbiguity(ctx.AND());

        Formula result = visit(ctx.negation(0));
        for (int i = 1; i < ctx.negation().size(); i++) {
            result = Formula.and(result, visit(ctx.negation(i)));
        }
        return result;
    }

    /**
     * Più di un operatore dello stesso tipo allo stesso livello: il secondo è
     * quello che rende ambigua la catena.
     */
    private void recordAmbiguity(List<TerminalNode> operators) {
        if (operators.size() > 1 && ambiguousOperator == null) {
            ambiguousOperator = operators.get(1).getSymbol();
        }
    }

    //endregion

    //region NEGAZIONI, PARENTESI E ATOMI

    @Override
    public Formula visitNot(NotContext ctx) {
        return Formula.not(visit(ctx.negation()));
    }

    @Override
    public Formula visitVar(VarContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public Formula visitPar(ParContext ctx) {
        return visit(ctx.implication());
    }

    @Override
    public Formula visitId(IdContext ctx) {
        return Formula.atom(ctx.IDENTIFIER().getText());
    }

    //endregion
}
