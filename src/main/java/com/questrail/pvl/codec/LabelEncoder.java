package com.questrail.pvl.codec;

import com.questrail.pvl.model.LabelMapping;
import com.questrail.pvl.sink.ByteArrayLabelSink;
import com.questrail.pvl.sink.LabelSink;

/**
 * LabelEncoder
 * -----------------------------------------------------------------------------
 * Serializes a label tree into dialect-correct text.
 *
 * <p>This interface defines the outbound boundary between an in-memory
 * {@link LabelMapping} and raw label bytes. It does NOT parse, validate or
 * normalize labels.</p>
 *
 * <h2>Output contract</h2>
 * <ul>
 *   <li>Statements are written in tree order, one per line, each line ending
 *       with {@code \n}</li>
 *   <li>The dialect's terminal token is written last, with <strong>no</strong>
 *       trailing line break; callers that want one append it themselves</li>
 *   <li>Text is UTF-8</li>
 * </ul>
 *
 * <h2>Failure contract</h2>
 * <p>Encoding stops at the first {@link LabelEncodeException}. The sink is
 * append-only: bytes already written are not retracted. Use
 * {@link #encodeToBytes(LabelMapping)} for all-or-nothing output.</p>
 *
 * <p>Implementations must be immutable and safe to call from several threads
 * at once.</p>
 */
public interface LabelEncoder
{
    /**
     * Encode {@code label} and append the text to {@code sink}.
     *
     * @throws UnsupportedValueException if a value has no textual mapping
     * @throws EncodingRejectedException if a text value can not be quoted
     */
    void encode(LabelMapping label, LabelSink sink);

    /**
     * Encode {@code label} into a private buffer and return its bytes.
     * Nothing is produced if encoding fails.
     */
    default byte[] encodeToBytes(LabelMapping label)
    {
        ByteArrayLabelSink buffer = new ByteArrayLabelSink();
        encode(label, buffer);
        return buffer.toByteArray();
    }

    /**
     * Encode {@code label} into a private buffer and return it as a string.
     */
    default String encodeToString(LabelMapping label)
    {
        ByteArrayLabelSink buffer = new ByteArrayLabelSink();
        encode(label, buffer);
        return buffer.toString();
    }
}
