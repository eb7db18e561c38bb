/**
 * Binary formats: dat blob decryption, image signatures, MP3 encoding and parsing.
 */
package com.libragraph.chatmedia.formats;
