// file: src/main/java/io/cardstore/server/dto/MutationResponse.java
package io.cardstore.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON response for successful mutations.
 * Example for PUT /cards:
 *   { "ok": true }
 * Example for POST /cards/upsert:
 *   { "ok": true, "version": 3, "updated": 1 }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MutationResponse {
    public boolean ok;
    public Long version;     // upsert only
    public Integer updated;  // upsert only: incoming records processed
}
