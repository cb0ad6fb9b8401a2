package com.flagship.invoice_ledger.extraction;

import com.flagship.invoice_ledger.provider.ImagePayload;
import lombok.Value;

/**
 * An uploaded document as handed over by the ingestion layer.
 * The MIME type has already been checked against the allow-list.
 */
@Value
public class SourceFile {
    String fileId;
    byte[] data;
    String mimeType;

    public ImagePayload toPayload() {
        return new ImagePayload(data, mimeType);
    }
}
