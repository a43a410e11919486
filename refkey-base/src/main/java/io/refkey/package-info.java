/*
 * Copyright 2025 Babak Farhang
 */
/**
 * Short, human-transcribable tokens that bind an event (two participants, a
 * date and a time) to a secret.
 * 
 * <h2>Flow</h2>
 * <p>
 * Raw names are {@linkplain io.refkey.Canonicalizer canonicalized} so that
 * spelling variants collapse; a {@linkplain io.refkey.TokenDeriver deriver}
 * hashes the canonical attributes with the secret and keeps a short, uppercase
 * hex prefix. A {@linkplain io.refkey.Verifier verifier} re-derives and compares.
 * </p>
 * <p>
 * Everything here is pure and thread-safe.
 * </p>
 */
package io.refkey;
