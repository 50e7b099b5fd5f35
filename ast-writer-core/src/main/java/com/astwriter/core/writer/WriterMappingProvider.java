package com.astwriter.core.writer;

import com.astwriter.core.format.SourceFormatter;

/**
 * Service provider supplying a complete writer catalog for one language.
 *
 * <p>Providers are discovered via Java Service Provider Interface (SPI) and selected by
 * {@link #getId()} in configuration. A provider bundles the structured-node mapping and
 * the IR mapping of its language.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class SolidityMappingProvider implements WriterMappingProvider {
 *     @Override
 *     public String getId() {
 *         return "solidity";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "Solidity Writers";
 *     }
 *
 *     @Override
 *     public AstWriterMapping getAstMapping() {
 *         return AST_MAPPING;
 *     }
 *
 *     @Override
 *     public IrWriterMapping getIrMapping() {
 *         return IR_MAPPING;
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.astwriter.core.writer.WriterMappingProvider}
 *
 * @see WriterMappingProviders
 */
public interface WriterMappingProvider {

    /**
     * Returns unique identifier for this provider.
     *
     * <p>Used for referencing the provider in configuration. Should be lowercase
     * (e.g., "solidity").
     *
     * @return unique provider identifier
     */
    String getId();

    /**
     * Returns human-readable display name, used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the writers for structured nodes.
     *
     * @return structured-node mapping
     */
    AstWriterMapping getAstMapping();

    /**
     * Returns the writers for IR nodes.
     *
     * @return IR mapping, empty if the language has no IR
     */
    IrWriterMapping getIrMapping();

    /**
     * Creates a structured-tree writer over this provider's mapping.
     *
     * @param formatter layout policy
     * @param targetVersion target language version
     * @return new writer
     */
    default AstWriter createAstWriter(SourceFormatter formatter, String targetVersion) {
        return new AstWriter(getAstMapping(), formatter, targetVersion);
    }

    /**
     * Creates an IR writer over this provider's IR mapping.
     *
     * @param formatter layout policy
     * @return new writer
     */
    default IrWriter createIrWriter(SourceFormatter formatter) {
        return new IrWriter(getIrMapping(), formatter);
    }
}
