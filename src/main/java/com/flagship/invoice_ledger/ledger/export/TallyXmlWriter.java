package com.flagship.invoice_ledger.ledger.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.flagship.invoice_ledger.ledger.LedgerDocument;
import com.flagship.invoice_ledger.ledger.LedgerMaster;
import com.flagship.invoice_ledger.ledger.Voucher;
import com.flagship.invoice_ledger.ledger.VoucherEntry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link LedgerDocument} as a Tally "Import Data" envelope.
 *
 * Message order inside REQUESTDATA is groups, then ledgers, then vouchers, so every
 * master a voucher references is created before the voucher is imported.
 * Tally reads amounts from the ledger's point of view: a debit entry is written
 * with ISDEEMEDPOSITIVE=Yes and a negative amount, a credit with No and a positive one.
 */
@Component
@Slf4j
public class TallyXmlWriter {

    private static final DateTimeFormatter TALLY_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final String CREATE = "Create";

    private final XmlMapper xmlMapper;

    public TallyXmlWriter() {
        this.xmlMapper = XmlMapper.builder()
            .defaultUseWrapper(false)
            .configure(ToXmlGenerator.Feature.WRITE_XML_DECLARATION, true)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();
        this.xmlMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        this.xmlMapper.configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);
    }

    public byte[] write(LedgerDocument document) {
        List<TallyMessage> messages = new ArrayList<>();
        for (Map.Entry<String, String> group : document.getGroups().entrySet()) {
            messages.add(TallyMessage.group(new GroupXml(group.getKey(), CREATE,
                new NameList(group.getKey()), group.getValue())));
        }
        for (LedgerMaster ledger : document.getLedgers()) {
            messages.add(TallyMessage.ledger(new LedgerXml(
                ledger.getName(),
                CREATE,
                new NameList(ledger.getName()),
                ledger.getParent(),
                ledger.getPartyTaxId(),
                ledger.getGstRate() != null ? "GST" : null,
                ledger.getGstRate())));
        }
        for (Voucher voucher : document.getVouchers()) {
            messages.add(TallyMessage.voucher(toXml(voucher)));
        }

        Envelope envelope = new Envelope(
            new Header("Import Data"),
            new Body(new ImportData(
                new RequestDesc("All Masters", new StaticVariables(document.getCompanyName())),
                new RequestData(messages))));

        try {
            byte[] xml = xmlMapper.writeValueAsBytes(envelope);
            log.debug("Wrote Tally XML: groups={}, ledgers={}, vouchers={}, bytes={}",
                document.getGroups().size(), document.getLedgers().size(), document.getVouchers().size(), xml.length);
            return xml;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Ledger document could not be written as Tally XML", e);
        }
    }

    private static VoucherXml toXml(Voucher voucher) {
        List<EntryXml> entries = new ArrayList<>(voucher.getEntries().size());
        for (VoucherEntry entry : voucher.getEntries()) {
            entries.add(new EntryXml(
                entry.getLedgerName(),
                entry.isDebit() ? "Yes" : "No",
                entry.getLedgerName().equals(voucher.getPartyLedger()) ? "Yes" : "No",
                entry.getAmount().negate().toPlainString()));
        }
        return new VoucherXml(
            voucher.getVoucherType(),
            CREATE,
            voucher.getDate().format(TALLY_DATE),
            voucher.getVoucherType(),
            voucher.getNumber(),
            voucher.getPartyLedger(),
            voucher.getNarration(),
            entries);
    }

    @Value
    @JacksonXmlRootElement(localName = "ENVELOPE")
    @JsonPropertyOrder({"HEADER", "BODY"})
    static class Envelope {
        @JacksonXmlProperty(localName = "HEADER")
        Header header;
        @JacksonXmlProperty(localName = "BODY")
        Body body;
    }

    @Value
    static class Header {
        @JacksonXmlProperty(localName = "TALLYREQUEST")
        String tallyRequest;
    }

    @Value
    static class Body {
        @JacksonXmlProperty(localName = "IMPORTDATA")
        ImportData importData;
    }

    @Value
    @JsonPropertyOrder({"REQUESTDESC", "REQUESTDATA"})
    static class ImportData {
        @JacksonXmlProperty(localName = "REQUESTDESC")
        RequestDesc requestDesc;
        @JacksonXmlProperty(localName = "REQUESTDATA")
        RequestData requestData;
    }

    @Value
    @JsonPropertyOrder({"REPORTNAME", "STATICVARIABLES"})
    static class RequestDesc {
        @JacksonXmlProperty(localName = "REPORTNAME")
        String reportName;
        @JacksonXmlProperty(localName = "STATICVARIABLES")
        StaticVariables staticVariables;
    }

    @Value
    static class StaticVariables {
        @JacksonXmlProperty(localName = "SVCURRENTCOMPANY")
        String currentCompany;
    }

    @Value
    static class RequestData {
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "TALLYMESSAGE")
        List<TallyMessage> messages;
    }

    @Value
    @JsonPropertyOrder({"GROUP", "LEDGER", "VOUCHER"})
    static class TallyMessage {
        @JacksonXmlProperty(localName = "GROUP")
        GroupXml group;
        @JacksonXmlProperty(localName = "LEDGER")
        LedgerXml ledger;
        @JacksonXmlProperty(localName = "VOUCHER")
        VoucherXml voucher;

        static TallyMessage group(GroupXml group) {
            return new TallyMessage(group, null, null);
        }

        static TallyMessage ledger(LedgerXml ledger) {
            return new TallyMessage(null, ledger, null);
        }

        static TallyMessage voucher(VoucherXml voucher) {
            return new TallyMessage(null, null, voucher);
        }
    }

    @Value
    static class NameList {
        @JacksonXmlProperty(localName = "NAME")
        String name;
    }

    @Value
    @JsonPropertyOrder({"NAME", "ACTION", "NAME.LIST", "PARENT"})
    static class GroupXml {
        @JacksonXmlProperty(localName = "NAME", isAttribute = true)
        String name;
        @JacksonXmlProperty(localName = "ACTION", isAttribute = true)
        String action;
        @JacksonXmlProperty(localName = "NAME.LIST")
        NameList names;
        @JacksonXmlProperty(localName = "PARENT")
        String parent;
    }

    @Value
    @JsonPropertyOrder({"NAME", "ACTION", "NAME.LIST", "PARENT", "PARTYGSTIN", "TAXTYPE", "GSTRATE"})
    static class LedgerXml {
        @JacksonXmlProperty(localName = "NAME", isAttribute = true)
        String name;
        @JacksonXmlProperty(localName = "ACTION", isAttribute = true)
        String action;
        @JacksonXmlProperty(localName = "NAME.LIST")
        NameList names;
        @JacksonXmlProperty(localName = "PARENT")
        String parent;
        @JacksonXmlProperty(localName = "PARTYGSTIN")
        String partyGstin;
        @JacksonXmlProperty(localName = "TAXTYPE")
        String taxType;
        @JacksonXmlProperty(localName = "GSTRATE")
        Integer gstRate;
    }

    @Value
    @JsonPropertyOrder({"VCHTYPE", "ACTION", "DATE", "VOUCHERTYPENAME", "VOUCHERNUMBER",
        "PARTYLEDGERNAME", "NARRATION", "ALLLEDGERENTRIES.LIST"})
    static class VoucherXml {
        @JacksonXmlProperty(localName = "VCHTYPE", isAttribute = true)
        String vchType;
        @JacksonXmlProperty(localName = "ACTION", isAttribute = true)
        String action;
        @JacksonXmlProperty(localName = "DATE")
        String date;
        @JacksonXmlProperty(localName = "VOUCHERTYPENAME")
        String voucherTypeName;
        @JacksonXmlProperty(localName = "VOUCHERNUMBER")
        String voucherNumber;
        @JacksonXmlProperty(localName = "PARTYLEDGERNAME")
        String partyLedgerName;
        @JacksonXmlProperty(localName = "NARRATION")
        String narration;
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "ALLLEDGERENTRIES.LIST")
        List<EntryXml> entries;
    }

    @Value
    @JsonPropertyOrder({"LEDGERNAME", "ISDEEMEDPOSITIVE", "ISPARTYLEDGER", "AMOUNT"})
    static class EntryXml {
        @JacksonXmlProperty(localName = "LEDGERNAME")
        String ledgerName;
        @JacksonXmlProperty(localName = "ISDEEMEDPOSITIVE")
        String deemedPositive;
        @JacksonXmlProperty(localName = "ISPARTYLEDGER")
        String partyLedger;
        @JacksonXmlProperty(localName = "AMOUNT")
        String amount;
    }
}
