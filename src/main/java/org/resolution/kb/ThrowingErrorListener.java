package org.resolution.kb;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Trasforma il primo errore lessicale o sintattico di ANTLR in un'eccezione
 * con riga e colonna, invece di lasciare che il parser tenti il recupero.
 */
class ThrowingErrorListener extends BaseErrorListener {

    private final String sourceName;

    ThrowingErrorListener(String sourceName) {
        this.sourceName = sourceName;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        throw new IllegalArgumentException("Errore di sintassi in " + sourceName + " alla riga "
                + line + ":" + charPositionInLine + " - " + msg, e);
    }
}
