package uk.gegc.videobatch.features.remote.application;

/**
 * @param mediaReference optional reference image, already resolvable by the provider
 * @param idempotencyKey optional provider side dedup key
 */
public record RemoteJobRequest(
        String prompt,
        String mediaReference,
        String model,
        String orientation,
        String size,
        int duration,
        String idempotencyKey
) {}
