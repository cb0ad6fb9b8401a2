package com.flagship.invoice_ledger.ledger.export;

import com.flagship.invoice_ledger.job.TransactionType;
import com.flagship.invoice_ledger.ledger.LedgerDocument;
import com.flagship.invoice_ledger.ledger.LedgerSynthesisService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.flagship.invoice_ledger.ledger.LedgerFixtures.completedJob;
import static com.flagship.invoice_ledger.ledger.LedgerFixtures.intraStateInvoice;
import static com.flagship.invoice_ledger.ledger.LedgerFixtures.success;
import static org.junit.jupiter.api.Assertions.*;

class TallyXmlWriterTest {

    private final TallyXmlWriter writer = new TallyXmlWriter();
    private Document xml;

    @BeforeEach
    void setUp() throws Exception {
        LedgerDocument document = new LedgerSynthesisService().synthesize(completedJob(TransactionType.SALES, List.of(
                success("a.png", intraStateInvoice("INV-1").build()),
                success("b.png", intraStateInvoice("INV-2").partyName("Beta & Sons").build()))));
        byte[] bytes = writer.write(document);
        xml = DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(new ByteArrayInputStream(bytes));
    }

    private String text(String tag) {
        return xml.getElementsByTagName(tag).item(0).getTextContent();
    }

    private List<Element> messageBodies() {
        List<Element> bodies = new ArrayList<>();
        NodeList messages = xml.getElementsByTagName("TALLYMESSAGE");
        for (int i = 0; i < messages.getLength(); i++) {
            NodeList children = messages.item(i).getChildNodes();
            for (int j = 0; j < children.getLength(); j++) {
                if (children.item(j).getNodeType() == Node.ELEMENT_NODE) {
                    bodies.add((Element) children.item(j));
                }
            }
        }
        return bodies;
    }

    @Test
    @DisplayName("Envelope carries the import request for the company")
    void writesEnvelope() {
        assertEquals("ENVELOPE", xml.getDocumentElement().getTagName());
        assertEquals("Import Data", text("TALLYREQUEST"));
        assertEquals("All Masters", text("REPORTNAME"));
        assertEquals("Flagship Pvt Ltd", text("SVCURRENTCOMPANY"));
    }

    @Test
    @DisplayName("Groups come before ledgers, ledgers before vouchers")
    void ordersMessages() {
        List<String> kinds = messageBodies().stream().map(Element::getTagName).toList();

        assertEquals(List.of("GROUP", "GROUP", "GROUP",
                "LEDGER", "LEDGER", "LEDGER", "LEDGER",
                "VOUCHER", "VOUCHER"), kinds);
        Element taxGroup = messageBodies().get(2);
        assertEquals("Duties & Taxes", taxGroup.getAttribute("NAME"));
        assertEquals("Create", taxGroup.getAttribute("ACTION"));
    }

    @Test
    @DisplayName("Every ledger used by a voucher entry is created in the same file")
    void referencedLedgersAreDefined() {
        Set<String> defined = new HashSet<>();
        for (Element body : messageBodies()) {
            if (body.getTagName().equals("LEDGER")) {
                defined.add(body.getAttribute("NAME"));
            }
        }
        NodeList used = xml.getElementsByTagName("LEDGERNAME");
        assertEquals(8, used.getLength());
        for (int i = 0; i < used.getLength(); i++) {
            assertTrue(defined.contains(used.item(i).getTextContent()), used.item(i).getTextContent());
        }
    }

    @Test
    @DisplayName("Debits are written deemed-positive with a negative amount")
    void writesEntrySigns() {
        Element voucher = messageBodies().stream()
                .filter(body -> body.getTagName().equals("VOUCHER"))
                .findFirst()
                .orElseThrow();
        assertEquals("Sales", voucher.getAttribute("VCHTYPE"));
        assertEquals("20240115", voucher.getElementsByTagName("DATE").item(0).getTextContent());
        assertEquals("INV-1", voucher.getElementsByTagName("VOUCHERNUMBER").item(0).getTextContent());

        NodeList entries = voucher.getElementsByTagName("ALLLEDGERENTRIES.LIST");
        assertEquals(4, entries.getLength());
        Element party = (Element) entries.item(0);
        assertEquals("Acme Traders", party.getElementsByTagName("LEDGERNAME").item(0).getTextContent());
        assertEquals("Yes", party.getElementsByTagName("ISDEEMEDPOSITIVE").item(0).getTextContent());
        assertEquals("Yes", party.getElementsByTagName("ISPARTYLEDGER").item(0).getTextContent());
        assertEquals("-1180.00", party.getElementsByTagName("AMOUNT").item(0).getTextContent());

        Element sales = (Element) entries.item(1);
        assertEquals("No", sales.getElementsByTagName("ISDEEMEDPOSITIVE").item(0).getTextContent());
        assertEquals("1000.00", sales.getElementsByTagName("AMOUNT").item(0).getTextContent());
    }

    @Test
    @DisplayName("Tax ledgers carry their GST rate")
    void writesTaxLedger() {
        Element taxLedger = messageBodies().stream()
                .filter(body -> "Sales - GST 18%".equals(body.getAttribute("NAME")))
                .findFirst()
                .orElseThrow();
        assertEquals("LEDGER", taxLedger.getTagName());
        assertEquals("Duties & Taxes", taxLedger.getElementsByTagName("PARENT").item(0).getTextContent());
        assertEquals("GST", taxLedger.getElementsByTagName("TAXTYPE").item(0).getTextContent());
        assertEquals("18", taxLedger.getElementsByTagName("GSTRATE").item(0).getTextContent());
    }
}
