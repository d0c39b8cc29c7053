package org.resolution;

import org.resolution.kb.KnowledgeBase;
import org.resolution.kb.KnowledgeBaseLoader;
import org.resolution.model.Clause;
import org.resolution.model.MalformedClauseException;
import org.resolution.saturation.ResolutionResult;
import org.resolution.saturation.SaturationLoop;
import org.resolution.saturation.Verdict;

import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * DIMOSTRATORE PER RISOLUZIONE - Refutazione su clausole CNF del primo ordine senza funzioni
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: base di conoscenza predefinita oppure file .kb (clausole CNF + goal)
 * 2. PARSING: ANTLR, con validazione delle arità dei predicati
 * 3. SATURAZIONE: risoluzione ripetuta fino a clausola vuota o punto fisso
 * 4. OUTPUT: traccia dei passi, prova estratta, verdetto (proved / not-proved), statistiche
 *
 * MODALITÀ OPERATIVE:
 * - Nessun parametro: base di conoscenza predefinita (Socrate è mortale)
 * - File singolo (-f): elaborazione di un file .kb
 * - Directory batch (-d): elaborazione di tutti i file .kb di una cartella
 * - Output directory (-o): salvataggio di RESULT/ e STATS/
 * - Verbose (-v): logging dettagliato dei passi
 *
 * CODICI DI USCITA:
 * - 0: esecuzione completata (qualunque sia il verdetto)
 * - 1: clausola malformata, errore di sintassi o di I/O
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String VERBOSE_PARAM = "-v";

    /**
     * Configurazione di logging sul classpath
     * */
    private static final String LOGGING_CONFIG_RESOURCE = "/logging.properties";

    /**
     * Sottocartelle di output
     * */
    private static final String RESULT_DIR = "RESULT";
    private static final String STATS_DIR = "STATS";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale del dimostratore.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        configureLogging();
        System.out.println("---> AVVIO DIMOSTRATORE PER RISOLUZIONE <---");

        int exitCode = 0;
        try {
            ProverConfiguration config = parseAndValidateArguments(args);
            if (config == null) return;

            if (config.verbose) {
                enableVerboseLogging();
            }
            displayConfigurationSummary(config);
            exitCode = executeMainPipeline(config);

        } catch (Exception e) {
            exitCode = handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE DIMOSTRATORE <---");
        }

        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Sceglie la modalità operativa e delega all'handler corrispondente.
     *
     * @return codice di uscita
     */
    private static int executeMainPipeline(ProverConfiguration config) throws IOException {
        if (config.inputPath == null) {
            System.out.println("[I] Modalità: Base di conoscenza predefinita");
            return processKnowledgeBase(KnowledgeBaseLoader.builtIn(), config).isPresent() ? 0 : 1;
        } else if (config.isFileMode) {
            System.out.println("[I] Modalità: Elaborazione file singolo");
            return processSingleFile(Paths.get(config.inputPath), config).isPresent() ? 0 : 1;
        } else {
            System.out.println("[I] Modalità: Elaborazione della directory");
            BatchSummary summary = processDirectoryBatch(config);
            return summary.failedFiles.isEmpty() ? 0 : 1;
        }
    }

    /**
     * Gestisce errori non previsti con messaggio utente e logging completo.
     */
    private static int handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        return 1;
    }

    //endregion

    //region LOGGING

    /**
     * Carica la configurazione di java.util.logging dal classpath, se presente.
     */
    private static void configureLogging() {
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIG_RESOURCE)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione logging non caricata: " + e.getMessage());
        }
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (var handler : root.getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }

    //endregion

    //region ELABORAZIONE

    /**
     * Carica ed elabora un singolo file .kb.
     *
     * @return verdetto, vuoto se il file non è stato elaborato
     */
    private static Optional<Verdict> processSingleFile(Path path, ProverConfiguration config) {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + path.getFileName());
        System.out.println("=========================\n");

        try {
            return processKnowledgeBase(KnowledgeBaseLoader.fromFile(path), config);
        } catch (IOException e) {
            System.out.println("[E] Base di conoscenza '" + path + "' non leggibile: " + e.getMessage());
        } catch (MalformedClauseException e) {
            System.out.println("[E] Clausola malformata in '" + path + "': " + e.getMessage());
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Base di conoscenza '" + path + "' non valida: " + e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Esegue la refutazione sulla base di conoscenza, stampa traccia e verdetto
     * e salva i risultati se è stata indicata una directory di output.
     */
    private static Optional<Verdict> processKnowledgeBase(KnowledgeBase knowledgeBase, ProverConfiguration config) {
        System.out.println("[I] Clausole iniziali (" + knowledgeBase.size() + "):");
        for (Clause clause : knowledgeBase.clauses()) {
            System.out.println("    " + clause);
        }
        System.out.println("\nAvvio risoluzione automatica...");

        SaturationLoop loop = new SaturationLoop(knowledgeBase.clauses());
        loop.setStepListener(step -> System.out.println("Risolto: " + step.toTraceLine()));
        ResolutionResult result = loop.run();

        displayResult(result);

        if (config.outputPath != null) {
            try {
                saveCompleteResults(knowledgeBase, result, config);
            } catch (IOException e) {
                System.out.println("[E] Errore durante il salvataggio dei risultati: " + e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.of(result.getVerdict());
    }

    private static void displayResult(ResolutionResult result) {
        System.out.println();
        if (result.isProved()) {
            System.out.println("[I] Clausola vuota derivata: il goal è conseguenza della base di conoscenza.");
            System.out.println("\nProva:");
        } else {
            System.out.println("[I] Clausola vuota non derivata: saturazione raggiunta.");
        }
        System.out.print(result.formatProof());
        System.out.println();
        System.out.print(result.getStatistics());
        System.out.println(result);
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    /**
     * Elabora tutti i file .kb di una directory; un errore su un file non
     * interrompe gli altri.
     */
    private static BatchSummary processDirectoryBatch(ProverConfiguration config) throws IOException {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        List<Path> files = findAllKnowledgeBaseFiles(config.inputPath);
        BatchSummary summary = new BatchSummary();
        if (files.isEmpty()) {
            System.out.println("[W] Nessuna base di conoscenza " + KnowledgeBaseLoader.KB_EXTENSION + " in " + config.inputPath);
            return summary;
        }

        for (Path file : files) {
            Optional<Verdict> verdict = processSingleFile(file, config);
            if (verdict.isPresent()) {
                summary.record(verdict.get());
            } else {
                LOGGER.warning("Base di conoscenza scartata: " + file);
                summary.recordFailure(file.getFileName().toString());
            }
            System.out.println();
        }

        displayBatchSummary(summary);
        return summary;
    }

    private static List<Path> findAllKnowledgeBaseFiles(String dirPath) throws IOException {
        try (Stream<Path> entries = Files.list(Paths.get(dirPath))) {
            return entries
                    .filter(path -> path.toString().toLowerCase().endsWith(KnowledgeBaseLoader.KB_EXTENSION))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        }
    }

    private static void displayBatchSummary(BatchSummary summary) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("Basi di conoscenza: " + summary.total());
        System.out.println("Esito proved: " + summary.proved);
        System.out.println("Esito not-proved: " + summary.notProved);
        System.out.println("Scartate per errori: " + summary.failedFiles.size());
        for (String name : summary.failedFiles) {
            System.out.println("    - " + name);
        }
        System.out.println("=========================================\n");
    }

    //endregion

    //region GESTIONE DELL'OUTPUT E SALVATAGGIO DEI FILE

    /**
     * Salva il report completo in RESULT/ e le statistiche in STATS/.
     */
    private static void saveCompleteResults(KnowledgeBase knowledgeBase, ResolutionResult result,
                                            ProverConfiguration config) throws IOException {
        String baseName = getBaseFileName(knowledgeBase.name());

        Path resultDir = Paths.get(config.outputPath, RESULT_DIR);
        Files.createDirectories(resultDir);
        Path resultFile = resultDir.resolve(baseName + ".result");
        try (Writer writer = new FileWriter(resultFile.toFile())) {
            writeStructuredResult(writer, knowledgeBase, result);
        }
        System.out.println("[I] Risultati salvati: " + resultFile);

        Path statsDir = Paths.get(config.outputPath, STATS_DIR);
        Files.createDirectories(statsDir);
        Path statsFile = statsDir.resolve(baseName + ".stats");
        try (Writer writer = new FileWriter(statsFile.toFile())) {
            writer.write(result.getStatistics().toString());
        }
        System.out.println("[I] Statistiche salvate: " + statsFile);
    }

    static void writeStructuredResult(Writer writer, KnowledgeBase knowledgeBase, ResolutionResult result)
            throws IOException {
        writer.write("=== REFUTAZIONE PER RISOLUZIONE ===\n");
        writer.write("Base di conoscenza: " + knowledgeBase.name() + "\n");
        writer.write("Predicati: " + knowledgeBase.signature() + "\n");
        writer.write("\n" + "=".repeat(50) + "\n\n");

        writer.write("Clausole iniziali:\n");
        for (int i = 0; i < result.getSeeds().size(); i++) {
            writer.write("[" + (i + 1) + "] " + result.getSeeds().get(i) + "\n");
        }

        writer.write("\nTraccia:\n");
        writer.write(result.getTrace().isEmpty() ? "(nessun risolvente nuovo)\n" : result.formatTrace());

        writer.write("\nProva:\n");
        writer.write(result.formatProof());

        writer.write("\n" + "=".repeat(50) + "\n\n");
        writer.write(result.getStatistics().toString());
        writer.write(result + "\n");
    }

    private static String getBaseFileName(String name) {
        String fileName = Paths.get(name).getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static ProverConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(ProverConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE DIMOSTRATORE <<--");
        if (config.inputPath == null) {
            System.out.println("Input: " + KnowledgeBaseLoader.BUILT_IN_RESOURCE);
        } else {
            System.out.println("Modalità: " + (config.isFileMode ? "File singolo" : "Directory"));
            System.out.println("Input: " + config.inputPath);
        }
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Solo console"));
        System.out.println("Logging dettagliato: " + (config.verbose ? "Sì" : "No"));
        System.out.println("====================================\n");
    }

    private static void printApplicationHelp() {
        System.out.println("\n===============================================");
        System.out.println("      DIMOSTRATORE PER RISOLUZIONE - GUIDA");
        System.out.println("===============================================\n");

        System.out.println("UTILIZZO:");
        System.out.println("  (nessun parametro)  Base di conoscenza predefinita (Socrate è mortale)");
        System.out.println("  -f <file.kb>        Elabora un singolo file");
        System.out.println("  -d <directory>      Elabora tutti i file .kb di una directory");
        System.out.println("  -o <directory>      Salva RESULT/ e STATS/ nella directory indicata");
        System.out.println("  -v                  Logging dettagliato dei passi");
        System.out.println("  -h                  Mostra questa guida\n");

        System.out.println("FORMATO .kb:");
        System.out.println("  % commento");
        System.out.println("  predicate man/1.            dichiarazione di arità (facoltativa)");
        System.out.println("  { !man(X), mortal(X) }      clausola; negazione con ! ~ ¬");
        System.out.println("  { greek(socrates) }         variabili maiuscole, costanti minuscole");
        System.out.println("  goal mortal(socrates).      goal, aggiunto negato come clausola\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar solutore-risoluzione.jar");
        System.out.println("  java -jar solutore-risoluzione.jar -f socrate.kb -v");
        System.out.println("  java -jar solutore-risoluzione.jar -d ./basi/ -o ./output/\n");

        System.out.println("ESITO:");
        System.out.println("  proved       clausola vuota derivata, il goal è dimostrato");
        System.out.println("  not-proved   saturazione senza clausola vuota");
        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    static class ProverConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final boolean verbose;

        ProverConfiguration(String inputPath, String outputPath, boolean isFileMode, boolean verbose) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.verbose = verbose;
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    static class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        ProverConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            String inputParam = null;
            boolean verbose = false;

            for (int i = 0; i < args.length; i++) {
                String param = args[i];
                switch (param) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM, DIR_PARAM -> {
                        if (inputParam != null) {
                            throw new IllegalArgumentException("Una sola sorgente ammessa: " + inputParam
                                    + " e " + param + " sono mutualmente esclusivi");
                        }
                        inputParam = param;
                        inputPath = valueOf(args, ++i, param);
                        requireReadable(Paths.get(inputPath), param.equals(DIR_PARAM));
                    }
                    case OUTPUT_PARAM -> {
                        outputPath = valueOf(args, ++i, param);
                        prepareOutputDirectory(Paths.get(outputPath));
                    }
                    case VERBOSE_PARAM -> verbose = true;
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + param);
                }
            }

            return new ProverConfiguration(inputPath, outputPath, FILE_PARAM.equals(inputParam), verbose);
        }

        private String valueOf(String[] args, int index, String param) {
            if (index >= args.length || args[index].startsWith("-")) {
                throw new IllegalArgumentException("Manca il percorso dopo " + param);
            }
            return args[index];
        }

        /**
         * Verifica che la sorgente esista, sia del tipo atteso e sia leggibile.
         */
        private void requireReadable(Path path, boolean directory) {
            String kind = directory ? "Directory" : "Base di conoscenza";
            if (!Files.exists(path)) {
                throw new IllegalArgumentException(kind + " inesistente: " + path);
            }
            if (directory ? !Files.isDirectory(path) : !Files.isRegularFile(path)) {
                throw new IllegalArgumentException(path + " non è " + (directory ? "una directory" : "un file .kb"));
            }
            if (!Files.isReadable(path)) {
                throw new IllegalArgumentException(kind + " senza permesso di lettura: " + path);
            }
        }

        private void prepareOutputDirectory(Path path) {
            if (Files.isDirectory(path)) {
                return;
            }
            if (Files.exists(path)) {
                throw new IllegalArgumentException("Output " + path + " esiste e non è una directory");
            }
            try {
                Files.createDirectories(path);
                System.out.println("[I] Creata directory di output: " + path);
            } catch (IOException e) {
                throw new IllegalArgumentException("Directory di output non creabile: " + path, e);
            }
        }
    }

    /**
     * Conteggio dei verdetti di una elaborazione batch.
     */
    private static class BatchSummary {
        int proved = 0;
        int notProved = 0;
        final List<String> failedFiles = new ArrayList<>();

        void record(Verdict verdict) {
            if (verdict == Verdict.PROVED) proved++;
            else notProved++;
        }

        void recordFailure(String fileName) {
            failedFiles.add(fileName);
        }

        int total() {
            return proved + notProved + failedFiles.size();
        }
    }

    //endregion
}
