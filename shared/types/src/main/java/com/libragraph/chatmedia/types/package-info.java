/**
 * Pure Java value types shared across all chatmedia modules.
 *
 * <p>Content identifiers and file-name helpers live in {@code shared/utils}.
 * This module has no dependencies.
 */
package com.libragraph.chatmedia.types;
