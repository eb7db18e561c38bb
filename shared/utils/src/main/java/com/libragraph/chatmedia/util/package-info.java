/**
 * Shared utilities: content identifiers and file-name normalization.
 */
package com.libragraph.chatmedia.util;
