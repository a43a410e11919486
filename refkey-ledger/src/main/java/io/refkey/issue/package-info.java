/*
 * Copyright 2025 Babak Farhang
 */
/**
 * Issuing tokens: derive, render, record.
 */
package io.refkey.issue;
