package io.arbor.core.execution;

import io.arbor.core.exception.EvaluationException;

/// Decodes textual output into structured values for the `json` output type.
///
/// The core has no JSON dependency; the serialization module supplies a Jackson-backed
/// implementation. Without a decoder, `json` output stays a string.
@FunctionalInterface
public interface ValueDecoder {

    /// Decodes a document.
    ///
    /// @param text the encoded value, not null
    /// @return the decoded value (maps, lists, numbers, strings, booleans or null)
    /// @throws EvaluationException if the text is malformed
    Object decode(String text) throws EvaluationException;
}
