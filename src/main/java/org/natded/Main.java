package org.natded;

import org.natded.deduction.SearchBudget;
import org.natded.render.RenderMode;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * DIMOSTRATORE IN DEDUZIONE NATURALE - Front end a linea di comando
 *
 * PIPELINE PER OGNI FORMULA:
 * 1. PARSING: notazione infissa (parole chiave, macro TeX o Unicode) -> albero sintattico (ANTLR)
 * 2. CONTROLLO CLASSICO: tavola di verità, le non-tautologie vengono rifiutate con un controesempio
 * 3. RICERCA: backward chaining con regole di introduzione ed eliminazione
 * 4. OUTPUT: albero di prova in notazione Plain oppure TeX (bussproofs)
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - Formula singola: le parole posizionali formano la formula
 * - Interattiva (-i): una formula per riga fino a "quit"
 * - Output su file (-o file) invece che su console
 * - Timeout per richiesta (-t secondi) e limiti della ricerca (-depth, -steps)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String TEX_PARAM = "-tex";
    private static final String OUTPUT_PARAM = "-o";
    private static final String INTERACTIVE_PARAM = "-i";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String DEPTH_PARAM = "-depth";
    private static final String STEPS_PARAM = "-steps";
    private static final String NO_CHECK_PARAM = "-nocheck";

    /**
     * Comando che termina la modalità interattiva
     * */
    private static final String QUIT_COMMAND = "quit";

    /**
     * Configurazioni timeout di default e limiti
     * */
    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    /**
     * Codici di uscita
     * */
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        loadLoggingConfiguration();

        PrintStream console = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        int exitCode = run(args, System.in, console);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue l'applicazione su flussi espliciti.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Apertura dell'eventuale file di output
     * 3. Modalità interattiva oppure formula singola
     *
     * @param args parametri linea di comando
     * @param in sorgente delle formule in modalità interattiva
     * @param console destinazione dei messaggi e, senza -o, delle prove
     * @return codice di uscita: 0 se tutte le richieste sono state dimostrate
     */
    static int run(String[] args, InputStream in, PrintStream console) {
        return run(args, in, console, new Prover());
    }

    /**
     * Come {@link #run(String[], InputStream, PrintStream)} con un dimostratore esplicito.
     */
    static int run(String[] args, InputStream in, PrintStream console, Prover prover) {
        ProverConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            console.println("[E] " + e.getMessage());
            console.println("Usa " + HELP_PARAM + " per visualizzare l'help.");
            return EXIT_USAGE;
        }

        if (config == null) {
            printApplicationHelp(console);
            return EXIT_OK;
        }

        try (Writer output = openOutput(config, console)) {
            boolean allProved = config.interactive
                    ? runInteractive(config, prover, in, console, output)
                    : processRequest(config.formulaText, config, prover, console, output);
            return allProved ? EXIT_OK : EXIT_FAILURE;

        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore di I/O", e);
            console.println("[E] Errore di I/O: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Legge la configurazione di java.util.logging dal classpath.
     */
    private static void loadLoggingConfiguration() {
        try (InputStream config = Main.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione di logging non leggibile: " + e.getMessage());
        }
    }

    //endregion

    //region ELABORAZIONE RICHIESTE

    /**
     * Legge una formula per riga fino a "quit" o alla fine dell'input.
     * Le righe vuote vengono ignorate; ogni fallimento interessa solo la
     * propria richiesta.
     *
     * @return true se tutte le formule lette sono state dimostrate
     */
    private static boolean runInteractive(ProverConfiguration config, Prover prover, InputStream in,
                                          PrintStream console, Writer output) throws IOException {
        console.println("[I] Modalità interattiva: una formula per riga, \"" + QUIT_COMMAND + "\" per uscire");

        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        boolean allProved = true;
        String line;

        while ((line = reader.readLine()) != null) {
            String text = line.trim();
            if (text.isEmpty()) {
                continue;
            }
            if (QUIT_COMMAND.equalsIgnoreCase(text)) {
                break;
            }
            allProved &= processRequest(text, config, prover, console, output);
            output.flush();
        }
        return allProved;
    }

    /**
     * Elabora una formula con timeout e scrive l'esito.
     *
     * @return true se la formula è stata dimostrata
     */
    private static boolean processRequest(String text, ProverConfiguration config, Prover prover,
                                          PrintStream console, Writer output) throws IOException {
        ProofOutcome outcome = executeWithTimeout(text, config, prover, console);
        if (outcome == null) {
            output.write("error when solving:\ntimeout after " + config.timeoutSeconds + "s: " + text + "\n");
            return false;
        }

        String displayText = outcome.toDisplayText();
        output.write(displayText.endsWith("\n") ? displayText : displayText + "\n");
        return outcome.isProved();
    }

    /**
     * Esegue la richiesta su un thread dedicato con limite temporale.
     *
     * La ricerca non controlla l'interruzione: dopo il timeout il thread
     * termina comunque entro i limiti di {@link SearchBudget}.
     *
     * Un errore sul thread di lavoro, anche un {@link StackOverflowError},
     * interrompe solo questa richiesta.
     *
     * @return esito della richiesta o null se timeout
     */
    private static ProofOutcome executeWithTimeout(String text, ProverConfiguration config,
                                                   Prover prover, PrintStream console) {
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Callable<ProofOutcome> proverTask = () -> prover.prove(text, config.options);
            Future<ProofOutcome> future = executor.submit(proverTask);
            return future.get(config.timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            console.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Elaborazione interrotta", e);
        } catch (ExecutionException e) {
            LOGGER.log(Level.SEVERE, "Errore durante la dimostrazione di: " + text, e.getCause());
            console.println("[E] Errore durante la dimostrazione: " + e.getCause());
            return ProofOutcome.internalError(null, String.valueOf(e.getCause()));
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Apre il file indicato con -o, altrimenti scrive sulla console senza
     * chiuderla.
     */
    private static Writer openOutput(ProverConfiguration config, PrintStream console) throws IOException {
        if (config.outputPath == null) {
            return new ConsoleWriter(console);
        }
        Path path = Paths.get(config.outputPath);
        console.println("[I] Output su file: " + path.toAbsolutePath());
        return Files.newBufferedWriter(path, StandardCharsets.UTF_8);
    }

    //endregion

    //region HELP

    private static void printApplicationHelp(PrintStream console) {
        console.println("\n::>> DIMOSTRATORE IN DEDUZIONE NATURALE <<::");
        console.println("Costruisce alberi di prova per formule proposizionali\n");

        console.println("UTILIZZO:");
        console.println("  java -jar dimostratore.jar [opzioni] <formula>");
        console.println("  java -jar dimostratore.jar [opzioni] -i\n");

        console.println("OPZIONI:");
        console.println("  -h            Mostra questo help");
        console.println("  -tex          Albero in notazione TeX (bussproofs) invece che Plain");
        console.println("  -o <file>     Scrive le prove sul file indicato");
        console.println("  -i            Modalità interattiva, una formula per riga, \"" + QUIT_COMMAND + "\" per uscire");
        console.println(String.format("  -t <sec>      Timeout per formula in secondi (default %d, minimo %d)",
                DEFAULT_TIMEOUT_SECONDS, MIN_TIMEOUT_SECONDS));
        console.println("  -depth <n>    Profondità massima della ricerca (default " + SearchBudget.DEFAULT_MAX_DEPTH + ")");
        console.println("  -steps <n>    Numero massimo di regole tentate (default "
                + SearchBudget.DEFAULT_MAX_RULE_APPLICATIONS + ")");
        console.println("  -nocheck      Salta il controllo classico con tavola di verità\n");

        console.println("SINTASSI FORMULE:");
        console.println("  connettivi:   not and or to | \\lnot \\land \\lor \\to | ¬ ∧ ∨ →");
        console.println("  precedenza:   not > and > or > to, \"to\" associa a destra");
        console.println("  catene come \"A and B and C\" vanno parentesizzate\n");

        console.println("ESEMPI:");
        console.println("  java -jar dimostratore.jar \"((A or B) to C) to (A to C) and (B to C)\"");
        console.println("  java -jar dimostratore.jar -tex -o prova.tex \"A to B to A\"");
    }

    //endregion

    //region CLASSI DI SUPPORTO

    /**
     * Parametri di esecuzione in forma immutabile.
     */
    private static class ProverConfiguration {
        final String formulaText;
        final String outputPath;
        final boolean interactive;
        final int timeoutSeconds;
        final ProverOptions options;

        ProverConfiguration(String formulaText, String outputPath, boolean interactive,
                            int timeoutSeconds, ProverOptions options) {
            this.formulaText = formulaText;
            this.outputPath = outputPath;
            this.interactive = interactive;
            this.timeoutSeconds = timeoutSeconds;
            this.options = options;
        }
    }

    /**
     * Writer sulla console che non chiude il flusso sottostante.
     */
    private static class ConsoleWriter extends Writer {
        private final PrintStream console;

        ConsoleWriter(PrintStream console) {
            this.console = console;
        }

        @Override
        public void write(char[] buffer, int offset, int length) {
            console.print(new String(buffer, offset, length));
        }

        @Override
        public void flush() {
            console.flush();
        }

        @Override
        public void close() {
            console.flush();
        }
    }

    /**
     * Parser per parametri linea di comando.
     *
     * Ogni parametro non valido produce una IllegalArgumentException con un
     * messaggio per l'utente.
     */
    private static class ArgumentParser {

        /**
         * PARAMETRI SUPPORTATI:
         * -h: Mostra help e termina
         * -tex: Output TeX
         * -o <file>: File di output
         * -i: Modalità interattiva (esclusiva con la formula posizionale)
         * -t <sec>: Timeout per formula
         * -depth <n>, -steps <n>: Limiti della ricerca
         * -nocheck: Disattiva il controllo classico
         * altre parole: testo della formula
         *
         * @param args parametri da linea comando forniti dall'utente
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri invalidi
         */
        ProverConfiguration parse(String[] args) {
            if (args.length == 0) {
                throw new IllegalArgumentException("Nessun parametro fornito");
            }

            String outputPath = null;
            boolean interactive = false;
            boolean tex = false;
            boolean classicalCheck = true;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            int maxDepth = SearchBudget.DEFAULT_MAX_DEPTH;
            long maxSteps = SearchBudget.DEFAULT_MAX_RULE_APPLICATIONS;
            List<String> formulaWords = new ArrayList<>();

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        return null;
                    }
                    case TEX_PARAM -> tex = true;
                    case OUTPUT_PARAM -> outputPath = getNextArgument(args, ++i, "file di output");
                    case INTERACTIVE_PARAM -> interactive = true;
                    case TIMEOUT_PARAM -> {
                        timeoutSeconds = parsePositive(getNextArgument(args, ++i, "timeout"), "Timeout");
                        if (timeoutSeconds < MIN_TIMEOUT_SECONDS) {
                            throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
                        }
                    }
                    case DEPTH_PARAM -> maxDepth = parsePositive(getNextArgument(args, ++i, "profondità"), "Profondità");
                    case STEPS_PARAM -> maxSteps = parsePositive(getNextArgument(args, ++i, "numero di regole"), "Numero di regole");
                    case NO_CHECK_PARAM -> classicalCheck = false;
                    default -> formulaWords.add(args[i]);
                }
            }

            if (interactive && !formulaWords.isEmpty()) {
                throw new IllegalArgumentException("La modalità interattiva non accetta formule come parametri: "
                        + String.join(" ", formulaWords));
            }
            if (!interactive && formulaWords.isEmpty()) {
                throw new IllegalArgumentException("Nessuna formula fornita");
            }

            ProverOptions options = new ProverOptions(
                    tex ? RenderMode.TEX : RenderMode.PLAIN,
                    new SearchBudget(maxDepth, maxSteps),
                    classicalCheck);

            return new ProverConfiguration(String.join(" ", formulaWords), outputPath,
                    interactive, timeoutSeconds, options);
        }

        private String getNextArgument(String[] args, int index, String description) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Parametro mancante: " + description);
            }
            return args[index];
        }

        private int parsePositive(String value, String description) {
            int parsed;
            try {
                parsed = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(description + " non numerico: " + value);
            }
            if (parsed <= 0) {
                throw new IllegalArgumentException(description + " deve essere positivo: " + value);
            }
            return parsed;
        }
    }

    //endregion
}
