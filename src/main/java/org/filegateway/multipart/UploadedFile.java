package org.filegateway.multipart;

/**
 * File part extracted from a multipart request body
 */
public class UploadedFile {

    private final String filename;
    private final byte[] content;

    public UploadedFile(String filename, byte[] content) {
        this.filename = filename;
        this.content = content;
    }

    public String getFilename() {
        return filename;
    }

    public byte[] getContent() {
        return content;
    }

    public int getSize() {
        return content.length;
    }
}
