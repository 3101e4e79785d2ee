package com.raditha.neardup.io;

/**
 * An input record or file that could not be used, with the reason it was dropped.
 *
 * @param id     Record identifier ({@code <file>:<line>}) or file path
 * @param reason Human readable cause
 */
public record SkippedInput(String id, String reason) {
}
