package org.natded.deduction;

/**
 * STATISTICHE DI RICERCA - Metriche raccolte da una singola {@link ProofSearch}
 *
 * Un'istanza per richiesta: i contatori non sono condivisi tra ricerche.
 */
public class ProofStatistics {

    //region CONTATORI

    /** Tentativi di regola (introduzioni, eliminazioni, usi di assunzioni) */
    private long ruleApplications = 0;

    /** Obiettivi abbandonati dopo aver esaurito le regole */
    private long backtracks = 0;

    /** Assunzioni introdotte, incluse quelle di rami poi scartati */
    private int assumptionsIntroduced = 0;

    /** Obiettivi scartati perché già pendenti sullo stesso cammino */
    private long cyclesCut = 0;

    /** Rami troncati dal limite di profondità */
    private long depthCutoffs = 0;

    /** Profondità massima raggiunta */
    private int maxDepthReached = 0;

    //endregion

    //region TIMING

    private final long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    public ProofStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region INCREMENTI

    public void incrementRuleApplications() {
        ruleApplications++;
    }

    public void incrementBacktracks() {
        backtracks++;
    }

    public void incrementAssumptionsIntroduced() {
        assumptionsIntroduced++;
    }

    public void incrementCyclesCut() {
        cyclesCut++;
    }

    public void incrementDepthCutoffs() {
        depthCutoffs++;
    }

    public void recordDepth(int depth) {
        if (depth > maxDepthReached) {
            maxDepthReached = depth;
        }
    }

    /**
     * Ferma il timer; le chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    //endregion

    //region ACCESSORS

    public long getRuleApplications() {
        return ruleApplications;
    }

    public long getBacktracks() {
        return backtracks;
    }

    public int getAssumptionsIntroduced() {
        return assumptionsIntroduced;
    }

    public long getCyclesCut() {
        return cyclesCut;
    }

    public long getDepthCutoffs() {
        return depthCutoffs;
    }

    public int getMaxDepthReached() {
        return maxDepthReached;
    }

    public long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    //endregion

    @Override
    public String toString() {
        return String.format("Stats[regole=%d, backtrack=%d, assunzioni=%d, cicli=%d, tagli=%d, profondità=%d, tempo=%dms]",
                ruleApplications, backtracks, assumptionsIntroduced, cyclesCut, depthCutoffs,
                maxDepthReached, getExecutionTimeMs());
    }
}
