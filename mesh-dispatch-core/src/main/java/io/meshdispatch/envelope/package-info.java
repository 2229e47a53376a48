/**
 * The radio message envelope and its JSON codec.
 */
package io.meshdispatch.envelope;
