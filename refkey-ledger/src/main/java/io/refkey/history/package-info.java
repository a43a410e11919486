/*
 * Copyright 2025 Babak Farhang
 */
/**
 * The history of issued tokens. The {@linkplain io.refkey.history.HistoryLedger
 * ledger} is append-only (or cleared wholesale) and every recorded token can be
 * {@linkplain io.refkey.history.HistoryAudit re-derived} from its entry.
 */
package io.refkey.history;
