/* (C)2026 */
package com.ammann.glycemia.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

/**
 * Names of the available glycemic indices.
 *
 * @param indices        every registered name in registration order
 * @param defaultIndices names evaluated when a request selects none
 */
@Schema(description = "Registered glycemic indices")
public record IndexCatalogDTO(
        @Schema(description = "All registered index names in registration order")
        List<String> indices,

        @Schema(description = "Index names evaluated when a request names none")
        List<String> defaultIndices
) {
}
