package com.flagship.invoice_ledger.provider;

import lombok.Value;

/**
 * One document submitted to a provider, with the MIME type declared at upload.
 */
@Value
public class ImagePayload {
    byte[] data;
    String mimeType;
}
