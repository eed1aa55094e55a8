package com.distindex.core.extract;

/**
 * An upload record.
 *
 * <p>Every column may be null. An upload whose release path cannot be built
 * never matches a distribution; a null upload time leaves the upload date empty.
 *
 * @param distribution distribution name parsed from the file name
 * @param version version parsed from the file name, may be null
 * @param author uploading author id
 * @param filename uploaded file name
 * @param released upload time in seconds since the epoch, may be null
 */
public record UploadRow(String distribution, String version, String author, String filename, Long released) {}
