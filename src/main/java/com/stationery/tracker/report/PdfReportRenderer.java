package com.stationery.tracker.report;

import com.lowagie.text.Document;
import com.lowagie.text.DocumentException;
import com.lowagie.text.Element;
import com.lowagie.text.Font;
import com.lowagie.text.FontFactory;
import com.lowagie.text.HeaderFooter;
import com.lowagie.text.PageSize;
import com.lowagie.text.Paragraph;
import com.lowagie.text.Phrase;
import com.lowagie.text.Rectangle;
import com.lowagie.text.pdf.PdfPCell;
import com.lowagie.text.pdf.PdfPTable;
import com.lowagie.text.pdf.PdfWriter;
import com.stationery.tracker.exception.ReportUnavailableException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.util.List;

@Component
@ConditionalOnClass(name = "com.lowagie.text.Document")
public class PdfReportRenderer {

    private static final Font TITLE = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 14);
    private static final Font HEADER = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 9);
    private static final Font BODY = FontFactory.getFont(FontFactory.HELVETICA, 9);

    public byte[] render(ReportTable table) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Document document = new Document(PageSize.A4, 36, 36, 42, 42);
        try {
            PdfWriter.getInstance(document, out);

            HeaderFooter footer = new HeaderFooter(new Phrase("Page ", BODY), true);
            footer.setAlignment(Element.ALIGN_CENTER);
            footer.setBorder(Rectangle.NO_BORDER);
            document.setFooter(footer);

            document.open();
            Paragraph title = new Paragraph(table.title(), TITLE);
            title.setSpacingAfter(10);
            document.add(title);

            List<ReportColumn> columns = table.columns();
            PdfPTable grid = new PdfPTable(columns.size());
            grid.setWidthPercentage(100);
            grid.setHeaderRows(1);
            for (ReportColumn column : columns) {
                PdfPCell cell = new PdfPCell(new Phrase(column.header(), HEADER));
                cell.setHorizontalAlignment(column.numeric() ? Element.ALIGN_RIGHT : Element.ALIGN_LEFT);
                cell.setGrayFill(0.9f);
                grid.addCell(cell);
            }
            for (List<String> row : table.rows()) {
                for (int i = 0; i < columns.size(); i++) {
                    String value = i < row.size() && row.get(i) != null ? row.get(i) : "";
                    PdfPCell cell = new PdfPCell(new Phrase(value, BODY));
                    cell.setHorizontalAlignment(columns.get(i).numeric() ? Element.ALIGN_RIGHT : Element.ALIGN_LEFT);
                    grid.addCell(cell);
                }
            }
            document.add(grid);

            for (String line : table.summary()) {
                Paragraph summary = new Paragraph(line, HEADER);
                summary.setAlignment(Element.ALIGN_RIGHT);
                document.add(summary);
            }
        } catch (DocumentException e) {
            throw new ReportUnavailableException("Failed to render " + table.title() + " as PDF", e);
        } finally {
            if (document.isOpen()) {
                document.close();
            }
        }
        return out.toByteArray();
    }
}
