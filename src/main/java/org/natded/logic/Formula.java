package org.natded.logic;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * FORMULA PROPOSIZIONALE - Valore algebrico immutabile
 *
 * Rappresenta una formula della logica proposizionale come albero di nodi
 * immutabili. Le formule sono valori puri: nessun riferimento al padre,
 * condivisibili liberamente tra rami diversi dell'albero di prova.
 *
 * COSTRUTTI SUPPORTATI:
 * • Atomo: variabile proposizionale (A, B, p1, ...)
 * • Negazione: ¬A
 * • Congiunzione: A ∧ B
 * • Disgiunzione: A ∨ B
 * • Implicazione: A → B (associativa a destra)
 *
 * UGUAGLIANZA:
 * • Strutturale, per forma e non per riferimento
 * • Due atomi sono uguali se e solo se hanno lo stesso nome
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodi supportati nella rappresentazione ad albero.
     */
    public enum Type {
        ATOM,   // Variabile atomica: A, B, C, ...
        NOT,    // Negazione: ¬A
        AND,    // Congiunzione: A ∧ B
        OR,     // Disgiunzione: A ∨ B
        TO      // Implicazione: A → B
    }

    /** Tipo del nodo corrente */
    private final Type type;

    /** Nome della variabile (solo per ATOM) */
    private final String name;

    /** Operando sinistro, o unico operando per NOT */
    private final Formula left;

    /** Operando destro (solo per AND, OR, TO) */
    private final Formula right;

    /** Hash precalcolato: le formule vengono usate come chiavi durante la ricerca */
    private final int hash;

    //endregion

    //region COSTRUZIONE

    private Formula(Type type, String name, Formula left, Formula right) {
        this.type = type;
        this.name = name;
        this.left = left;
        this.right = right;
        this.hash = Objects.hash(type, name, left, right);
    }

    /**
     * Crea una variabile atomica.
     *
     * @param name nome della variabile (non null, non vuoto)
     * @return formula atomica
     * @throws IllegalArgumentException se il nome è null o vuoto
     */
    public static Formula atom(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome variabile atomica non può essere null o vuoto");
        }
        return new Formula(Type.ATOM, name.trim(), null, null);
    }

    public static Formula not(Formula operand) {
        requireOperand(operand, "negazione");
        return new Formula(Type.NOT, null, operand, null);
    }

    public static Formula and(Formula left, Formula right) {
        requireOperand(left, "congiunzione");
        requireOperand(right, "congiunzione");
        return new Formula(Type.AND, null, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        requireOperand(left, "disgiunzione");
        requireOperand(right, "disgiunzione");
        return new Formula(Type.OR, null, left, right);
    }

    public static Formula to(Formula left, Formula right) {
        requireOperand(left, "implicazione");
        requireOperand(right, "implicazione");
        return new Formula(Type.TO, null, left, right);
    }

    private static void requireOperand(Formula operand, String operatorName) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando null per operatore " + operatorName);
        }
    }

    //endregion

    //region ACCESSORS

    public Type getType() {
        return type;
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    /**
     * @return nome della variabile per ATOM
     * @throws IllegalStateException se il nodo non è un atomo
     */
    public String getName() {
        if (type != Type.ATOM) {
            throw new IllegalStateException("getName() richiesto su nodo " + type);
        }
        return name;
    }

    /**
     * Operando sinistro per i connettivi binari, unico operando per NOT.
     */
    public Formula getLeft() {
        if (type == Type.ATOM) {
            throw new IllegalStateException("Un atomo non ha operandi");
        }
        return left;
    }

    /**
     * Operando destro per i connettivi binari.
     */
    public Formula getRight() {
        if (type == Type.ATOM || type == Type.NOT) {
            throw new IllegalStateException("Il nodo " + type + " non ha operando destro");
        }
        return right;
    }

    /**
     * Vero per atomi e negazioni: gli unici nodi che non richiedono parentesi
     * quando compaiono come operandi.
     */
    public boolean isLow() {
        return type == Type.ATOM || type == Type.NOT;
    }

    //endregion

    //region ANALISI E VALUTAZIONE

    /**
     * Raccoglie i nomi delle variabili atomiche in ordine alfabetico.
     */
    public Set<String> atoms() {
        Set<String> atoms = new TreeSet<>();
        collectAtoms(atoms);
        return atoms;
    }

    private void collectAtoms(Set<String> atoms) {
        switch (type) {
            case ATOM -> atoms.add(name);
            case NOT -> left.collectAtoms(atoms);
            case AND, OR, TO -> {
                left.collectAtoms(atoms);
                right.collectAtoms(atoms);
            }
        }
    }

    /**
     * Valuta la formula classicamente sotto un assegnamento completo.
     *
     * @param assignment valore di verità per ogni atomo della formula
     * @return valore di verità della formula
     * @throws IllegalArgumentException se manca il valore di qualche atomo
     */
    public boolean evaluate(Map<String, Boolean> assignment) {
        return switch (type) {
            case ATOM -> {
                Boolean value = assignment.get(name);
                if (value == null) {
                    throw new IllegalArgumentException("Nessun valore assegnato alla variabile " + name);
                }
                yield value;
            }
            case NOT -> !left.evaluate(assignment);
            case AND -> left.evaluate(assignment) && right.evaluate(assignment);
            case OR -> left.evaluate(assignment) || right.evaluate(assignment);
            case TO -> !left.evaluate(assignment) || right.evaluate(assignment);
        };
    }

    /**
     * Verifica se {@code target} è raggiungibile da questa formula per sole
     * eliminazioni di congiunzioni e conseguenti di implicazioni.
     */
    public boolean canYield(Formula target) {
        if (this.equals(target)) {
            return true;
        }
        return switch (type) {
            case AND -> left.canYield(target) || right.canYield(target);
            case TO -> right.canYield(target);
            default -> false;
        };
    }

    /**
     * Verifica se una disgiunzione è raggiungibile con le stesse eliminazioni di
     * {@link #canYield(Formula)}, inclusa la formula stessa. Una disgiunzione
     * raggiunta può dimostrare qualunque obiettivo per casi.
     */
    public boolean reachesDisjunction() {
        return switch (type) {
            case OR -> true;
            case AND -> left.reachesDisjunction() || right.reachesDisjunction();
            case TO -> right.reachesDisjunction();
            default -> false;
        };
    }

    //endregion

    //region UGUAGLIANZA STRUTTURALE

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        if (this.type != other.type || this.hash != other.hash) return false;

        return switch (type) {
            case ATOM -> name.equals(other.name);
            case NOT -> left.equals(other.left);
            case AND, OR, TO -> left.equals(other.left) && right.equals(other.right);
        };
    }

    @Override
    public int hashCode() {
        return hash;
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Notazione Plain con operatori Unicode: ¬ ∧ ∨ →.
     * Il risultato è rileggibile da {@link FormulaParser}.
     */
    @Override
    public String toString() {
        return format("¬", " ∧ ", " ∨ ", " → ");
    }

    /**
     * Notazione TeX con le macro \lnot, \land, \lor, \to.
     */
    public String toTex() {
        return format("\\lnot ", " \\land ", " \\lor ", " \\to ");
    }

    private String format(String not, String and, String or, String to) {
        return switch (type) {
            case ATOM -> name;
            case NOT -> not + operandText(left, left.isLow(), not, and, or, to);
            case AND -> operandText(left, left.isLow(), not, and, or, to) + and
                    + operandText(right, right.isLow(), not, and, or, to);
            case OR -> operandText(left, left.isLow(), not, and, or, to) + or
                    + operandText(right, right.isLow(), not, and, or, to);
            // Entrambi i lati tra parentesi se sono a loro volta implicazioni
            case TO -> operandText(left, !left.is(Type.TO), not, and, or, to) + to
                    + operandText(right, !right.is(Type.TO), not, and, or, to);
        };
    }

    private static String operandText(Formula operand, boolean bare,
                                      String not, String and, String or, String to) {
        String text = operand.format(not, and, or, to);
        return bare ? text : "(" + text + ")";
    }

    //endregion
}
