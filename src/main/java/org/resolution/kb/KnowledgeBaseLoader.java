package org.resolution.kb;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.resolution.antlr.ClauseSetLexer;
import org.resolution.antlr.ClauseSetParser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * CARICATORE BASE DI CONOSCENZA - Pipeline ANTLR dal testo alle clausole iniziali
 *
 * Processo completo: Lexing -> Parsing -> Visitor -> validazione arità.
 * Il primo errore di sintassi o di arità interrompe il caricamento.
 *
 * La base predefinita (il sillogismo di Socrate) è una risorsa del classpath
 * caricata con lo stesso parser dei file utente.
 */
public final class KnowledgeBaseLoader {

    private static final Logger LOGGER = Logger.getLogger(KnowledgeBaseLoader.class.getName());

    /** Risorsa con la base di conoscenza predefinita */
    public static final String BUILT_IN_RESOURCE = "/kb/greek_philosopher.kb";

    /** Estensione dei file di base di conoscenza */
    public static final String KB_EXTENSION = ".kb";

    private KnowledgeBaseLoader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Carica la base di conoscenza predefinita.
     *
     * @throws IOException se la risorsa non è leggibile
     */
    public static KnowledgeBase builtIn() throws IOException {
        try (InputStream input = KnowledgeBaseLoader.class.getResourceAsStream(BUILT_IN_RESOURCE)) {
            if (input == null) {
                throw new IOException("Risorsa non trovata: " + BUILT_IN_RESOURCE);
            }
            return parse(CharStreams.fromStream(input, StandardCharsets.UTF_8), BUILT_IN_RESOURCE);
        }
    }

    /**
     * Carica una base di conoscenza da file.
     *
     * @param path percorso del file .kb
     * @throws IOException se il file non è leggibile
     */
    public static KnowledgeBase fromFile(Path path) throws IOException {
        LOGGER.fine("Lettura base di conoscenza: " + path);
        return parse(CharStreams.fromPath(path, StandardCharsets.UTF_8), path.getFileName().toString());
    }

    /**
     * Carica una base di conoscenza da testo.
     *
     * @param text contenuto nel formato .kb
     * @param name nome usato nei messaggi di errore
     */
    public static KnowledgeBase fromString(String text, String name) {
        return parse(CharStreams.fromString(text, name), name);
    }

    private static KnowledgeBase parse(CharStream input, String name) {
        ThrowingErrorListener errorListener = new ThrowingErrorListener(name);

        ClauseSetLexer lexer = new ClauseSetLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        ClauseSetParser parser = new ClauseSetParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        ParseTree tree = parser.knowledgeBase();
        KnowledgeBaseReader reader = new KnowledgeBaseReader();
        reader.visit(tree);

        KnowledgeBase knowledgeBase = reader.toKnowledgeBase(name);
        LOGGER.info("Base di conoscenza '" + name + "' caricata: " + knowledgeBase.size()
                + " clausole, predicati " + knowledgeBase.signature());
        return knowledgeBase;
    }
}
