package org.pragmatica.cddl.parser;

import org.pragmatica.cddl.error.LexerException;

/**
 * Sequential supplier of tokens. Once input is exhausted every call returns {@link CddlToken.Eof}.
 */
@FunctionalInterface
public interface TokenSource {
    CddlToken next() throws LexerException;
}
