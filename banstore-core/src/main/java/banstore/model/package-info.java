/**
 * Value types: addresses and ranges, persisted rows, lifecycle states and deltas.
 */
package banstore.model;
