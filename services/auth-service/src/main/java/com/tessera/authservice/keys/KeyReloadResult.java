package com.tessera.authservice.keys;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of loading key material, as reported to operators. Contains key ids only.
 *
 * @param activeKeyId        kid new tokens are signed with
 * @param verificationKeyIds every kid accepted for verification
 * @param loadedAt           when the material was installed
 */
public record KeyReloadResult(String activeKeyId, List<String> verificationKeyIds, Instant loadedAt) {
}
