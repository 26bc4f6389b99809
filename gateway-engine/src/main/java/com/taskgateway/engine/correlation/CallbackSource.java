package com.taskgateway.engine.correlation;

import java.util.List;
import java.util.Set;

/**
 * An external system allowed to push callbacks, and how its payloads become resume signals.
 *
 * @param name               source name used in the webhook path
 * @param correlationKeyPointer JSON pointer locating the correlation key in the payload
 * @param messageName        message sent when the pending correlation does not name one
 * @param variablePrefix     prefix of every variable the signal carries
 * @param signalFields       payload fields (names or JSON pointers) copied into the signal
 * @param ignoredFields      top-level fields that differ between redeliveries and are left out of the hash
 */
public record CallbackSource(
    String name,
    String correlationKeyPointer,
    String messageName,
    String variablePrefix,
    List<String> signalFields,
    Set<String> ignoredFields
) {
    public static final String DW_LAW = "dw-law";

    public CallbackSource {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Callback source name is required");
        }
        if (correlationKeyPointer == null || !correlationKeyPointer.startsWith("/")) {
            throw new IllegalArgumentException("Correlation key pointer must be a JSON pointer: " + correlationKeyPointer);
        }
        variablePrefix = variablePrefix != null ? variablePrefix : "";
        signalFields = signalFields != null ? List.copyOf(signalFields) : List.of();
        ignoredFields = ignoredFields != null ? Set.copyOf(ignoredFields) : Set.of();
    }

    /**
     * The DW LAW process-search callback.
     */
    public static CallbackSource dwLaw() {
        return new CallbackSource(
            DW_LAW,
            "/chave_de_pesquisa",
            "retorno_dw_law",
            "dw_law_",
            List.of("chave_de_pesquisa", "numero_processo", "status_pesquisa", "descricao_status"),
            Set.of("timestamp", "data_envio")
        );
    }
}
