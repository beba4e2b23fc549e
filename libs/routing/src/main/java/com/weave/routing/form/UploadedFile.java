package com.weave.routing.form;

/**
 * Metadata of one uploaded file. Contents are never retained.
 *
 * @param name        form field name
 * @param fileName    file name submitted by the client
 * @param contentType content type of the part, or null
 * @param length      size in bytes
 */
public record UploadedFile(String name, String fileName, String contentType, long length) {
}
