/*
 * Copyright 2025 Babak Farhang
 */
/**
 * Message templates. A template is free text with up to five
 * {@linkplain io.refkey.template.Placeholder placeholders}; rendering it yields
 * the body of a {@linkplain io.refkey.template.MessagePayload message payload}.
 */
package io.refkey.template;
