package com.viffx.Expr.Utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Provides a two-character buffered reader for lexers, allowing controlled
 * advancement through a text stream one character at a time.
 *
 * <p>Subclasses hook {@link #onNextChar()} to keep their own position
 * bookkeeping; the buffer itself holds no line or column state.
 *
 * <p>EOF (end-of-file) is detected when the current character slot in the buffer
 * contains {@code -1}.
 */
public class LexicalCharacterBuffer {
    // ====== INSTANCE FIELDS ====== //

    /**
     * Reader supplying characters from the source text.
     */
    private final BufferedReader reader;

    /**
     * Holds the current and next character codes from the input stream.
     * <ul>
     *     <li>{@code buffer[0]} - current character</li>
     *     <li>{@code buffer[1]} - next lookahead character</li>
     * </ul>
     */
    private final int[] buffer = new int[2];

    /**
     * Indicates whether the end of the input has been reached.
     */
    private boolean eof;

    // ====== CONSTRUCTORS ====== //
    /**
     * Wraps the given reader and fills the two-character buffer.
     *
     * @param source the text being lexed
     * @throws IOException if an I/O error occurs while reading the first characters
     */
    public LexicalCharacterBuffer(Reader source) throws IOException {
        reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);

        buffer[0] = reader.read();
        buffer[1] = reader.read();

        eof = buffer[0] == -1;
    }

    // ====== PUBLIC API METHODS ====== //
    /**
     * Returns {@code true} if the end of the input has been reached.
     */
    public final boolean eof() {
        return eof;
    }

    /**
     * Returns the current character in the buffer.
     */
    public final char crntChar() {
        return (char) buffer[0];
    }

    /**
     * Advances the buffer by one character, shifting the lookahead character into
     * the current slot and reading a new lookahead from the underlying reader.
     *
     * <p>Before the shift, this method calls {@link #onNextChar()} so subclasses can
     * account for the character being left behind.
     *
     * @return the newly current character after advancing
     * @throws IOException if the end of the input has already been reached
     */
    public final char nextChar() throws IOException {
        if (eof) throw new IOException("Reached the end of the input.");

        onNextChar();

        buffer[0] = buffer[1];
        buffer[1] = reader.read();

        eof = buffer[0] == -1;

        return crntChar();
    }

    // ====== API HOOKS ====== //
    /**
     * Called immediately before advancing the buffer, while {@link #crntChar()} still
     * returns the character being consumed.
     */
    public void onNextChar() {}
}
