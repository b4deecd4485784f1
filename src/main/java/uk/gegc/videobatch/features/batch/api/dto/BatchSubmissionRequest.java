package uk.gegc.videobatch.features.batch.api.dto;

/**
 * One batch submission. Every unit of the batch shares this configuration.
 *
 * @param prompt         generation prompt, trimmed before validation
 * @param model          provider model identifier, e.g. {@code sora-2}
 * @param orientation    {@code portrait} or {@code landscape}
 * @param size           provider size tier, e.g. {@code small}
 * @param duration       clip length in seconds
 * @param count          number of units to generate
 * @param mediaReference optional reference image handed to the provider
 */
public record BatchSubmissionRequest(
        String prompt,
        String model,
        String orientation,
        String size,
        Integer duration,
        Integer count,
        String mediaReference
) {}
