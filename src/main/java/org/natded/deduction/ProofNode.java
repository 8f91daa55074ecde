package org.natded.deduction;

import org.natded.logic.Formula;
import org.natded.support.Assumption;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * NODO DI PROVA - Un passo di derivazione
 *
 * Ogni nodo contiene la formula dimostrata, la regola applicata e le premesse
 * ordinate. Le foglie sono assunzioni e portano il numero di riferimento
 * dell'assunzione usata; i nodi di →-intro e ∨-elim registrano i numeri che
 * scaricano. La relazione di scarico è solo un metadato numerico: nessun
 * puntatore dal figlio all'antenato.
 *
 * ORDINE DELLE PREMESSE:
 * • ∧-intro: [A, B]
 * • →-elim: [antecedente, implicazione]
 * • ∨-elim: [disgiunzione, caso sinistro, caso destro]
 *
 * I nodi sono immutabili.
 */
public final class ProofNode {

    //region ATTRIBUTI

    private final Formula formula;
    private final Rule rule;
    private final List<ProofNode> premises;

    /** Numero dell'assunzione usata, solo per le foglie */
    private final int reference;

    /**
     * Numeri scaricati, allineati alle premesse che ne sono lo scope:
     * →-intro scarica nella premessa 0, ∨-elim nelle premesse 1 e 2.
     */
    private final List<Integer> discharged;

    //endregion

    //region COSTRUZIONE

    private ProofNode(Formula formula, Rule rule, List<ProofNode> premises, int reference, List<Integer> discharged) {
        if (formula == null || rule == null) {
            throw new IllegalArgumentException("Formula e regola del nodo non possono essere null");
        }
        if (premises.size() != rule.getPremises()) {
            throw new ProofInvariantViolation("La regola " + rule + " richiede " + rule.getPremises()
                    + " premesse, ricevute " + premises.size());
        }

        this.formula = formula;
        this.rule = rule;
        this.premises = Collections.unmodifiableList(new ArrayList<>(premises));
        this.reference = reference;
        this.discharged = Collections.unmodifiableList(new ArrayList<>(discharged));
    }

    /**
     * Foglia: uso diretto di un'assunzione viva.
     */
    public static ProofNode assumption(Assumption assumption) {
        return new ProofNode(assumption.formula(), Rule.ASSUMPTION, List.of(), assumption.reference(), List.of());
    }

    /**
     * Inferenza che non scarica assunzioni.
     */
    public static ProofNode inference(Formula formula, Rule rule, ProofNode... premises) {
        if (rule.discharges() || rule == Rule.ASSUMPTION) {
            throw new IllegalArgumentException("Regola " + rule + " non costruibile come inferenza semplice");
        }
        return new ProofNode(formula, rule, List.of(premises), 0, List.of());
    }

    /**
     * →-intro: scarica l'antecedente nella sola premessa.
     */
    public static ProofNode impliesIntro(Formula formula, int discharged, ProofNode premise) {
        return new ProofNode(formula, Rule.IMPLIES_INTRO, List.of(premise), 0, List.of(discharged));
    }

    /**
     * ∨-elim: ogni caso scarica la propria assunzione.
     */
    public static ProofNode orElim(Formula formula, ProofNode disjunction,
                                   int leftCase, ProofNode leftProof,
                                   int rightCase, ProofNode rightProof) {
        return new ProofNode(formula, Rule.OR_ELIM, List.of(disjunction, leftProof, rightProof),
                0, List.of(leftCase, rightCase));
    }

    //endregion

    //region ACCESSORS

    public Formula getFormula() {
        return formula;
    }

    public Rule getRule() {
        return rule;
    }

    public List<ProofNode> getPremises() {
        return premises;
    }

    public boolean isLeaf() {
        return rule == Rule.ASSUMPTION;
    }

    /**
     * @return numero dell'assunzione usata dalla foglia
     * @throws IllegalStateException se il nodo non è una foglia
     */
    public int getReference() {
        if (!isLeaf()) {
            throw new IllegalStateException("Solo le foglie hanno un numero di riferimento");
        }
        return reference;
    }

    public List<Integer> getDischarged() {
        return discharged;
    }

    /**
     * Numeri scaricati il cui scope è la premessa indicata.
     */
    public List<Integer> dischargedInto(int premiseIndex) {
        return switch (rule) {
            case IMPLIES_INTRO -> premiseIndex == 0 ? discharged : List.of();
            case OR_ELIM -> premiseIndex == 0 ? List.of() : List.of(discharged.get(premiseIndex - 1));
            default -> List.of();
        };
    }

    //endregion

    //region ANALISI

    /**
     * Numeri di riferimento usati dalle foglie del sottoalbero.
     */
    public Set<Integer> usedReferences() {
        Set<Integer> used = new TreeSet<>();
        collectReferences(used);
        return used;
    }

    private void collectReferences(Set<Integer> used) {
        if (isLeaf()) {
            used.add(reference);
            return;
        }
        for (ProofNode premise : premises) {
            premise.collectReferences(used);
        }
    }

    /**
     * Numero totale di nodi dell'albero.
     */
    public int size() {
        int count = 1;
        for (ProofNode premise : premises) {
            count += premise.size();
        }
        return count;
    }

    /**
     * Altezza dell'albero (una foglia ha altezza 0).
     */
    public int height() {
        int max = -1;
        for (ProofNode premise : premises) {
            max = Math.max(max, premise.height());
        }
        return max + 1;
    }

    //endregion

    @Override
    public String toString() {
        return isLeaf()
                ? formula + " from: " + reference
                : formula + " [" + rule + "]";
    }
}
