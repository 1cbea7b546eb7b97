// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.validation;

/**
 * @param hasResponse whether a score is recorded for the hash
 * @param score       the score, 0 when absent
 */
public record ResponseStatus(boolean hasResponse, int score) {

    static final ResponseStatus NONE = new ResponseStatus(false, 0);
}
