/*
 * Copyright 2025 Babak Farhang
 */
/**
 * JSON mapping, built on json-simple. Parsers are stateless and have
 * a shared {@code INSTANCE} (or {@code PARSER}).
 */
package io.refkey.json;
