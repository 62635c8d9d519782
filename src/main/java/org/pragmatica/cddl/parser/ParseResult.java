package org.pragmatica.cddl.parser;

import com.google.common.collect.ImmutableList;
import org.pragmatica.cddl.ast.Document;
import org.pragmatica.cddl.error.ParseError;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Outcome of parsing a document - either the document or every error found in the pass.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Errors in the order they were found. Empty on success.
     */
    List<ParseError> errors();

    Optional<Document> document();

    /**
     * The parsed document.
     *
     * @throws IllegalStateException listing the errors when parsing failed
     */
    default Document unwrap() {
        return document().orElseThrow(() -> new IllegalStateException(
        "Parsing failed: " + errors().stream()
                                     .map(ParseError::message)
                                     .collect(Collectors.joining("; "))));
    }

    static ParseResult success(Document document) {
        return new Success(document);
    }

    static ParseResult failure(List<ParseError> errors) {
        return new Failure(ImmutableList.copyOf(errors));
    }

    record Success(Document parsed) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public List<ParseError> errors() {
            return ImmutableList.of();
        }

        @Override
        public Optional<Document> document() {
            return Optional.of(parsed);
        }
    }

    record Failure(ImmutableList<ParseError> errors) implements ParseResult {
        public Failure {
            checkArgument(!errors.isEmpty(), "failure must carry at least one error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<Document> document() {
            return Optional.empty();
        }
    }
}
