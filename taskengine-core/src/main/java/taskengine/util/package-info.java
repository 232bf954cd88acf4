/**
 * Internal helpers.
 */
package taskengine.util;
