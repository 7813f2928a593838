package com.resumeForge.cvRenderer.output.service;

import com.resumeForge.cvRenderer.document.model.Alignment;
import com.resumeForge.cvRenderer.document.model.DocumentParagraph;
import com.resumeForge.cvRenderer.document.model.DocumentTree;
import com.resumeForge.cvRenderer.document.model.TabStop;
import com.resumeForge.cvRenderer.document.model.TextRun;
import com.resumeForge.cvRenderer.output.exception.DocumentWriteException;
import com.resumeForge.cvRenderer.style.model.PageLayout;
import com.resumeForge.cvRenderer.style.model.StyleDefinition;
import com.resumeForge.cvRenderer.style.model.StyleName;
import com.resumeForge.cvRenderer.style.model.StyleRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ooxml.POIXMLProperties;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFAbstractNum;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFNumbering;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTAbstractNum;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBody;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBorder;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTFonts;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTInd;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTLvl;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTP;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPBdr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPrGeneral;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageMar;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageSz;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSectPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSpacing;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTabStop;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTabs;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STBorder;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STJc;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STLineSpacingRule;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STNumberFormat;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTabJc;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Writes a {@link DocumentTree} as a .docx file with Apache POI.
 *
 * The style registry is lowered into native paragraph styles and a bullet numbering
 * definition; heading rules become paragraph bottom borders so they survive conversion.
 * The file is written to a temporary sibling and moved into place only once complete.
 */
@Slf4j
@Service
public class DocxDocumentSerializer {

    static final String CREATOR = "cv-renderer";
    static final String BULLET_GLYPH = "•";

    private static final int TWIPS_PER_POINT = 20;
    private static final int LINE_UNITS_PER_SINGLE_SPACING = 240;

    /**
     * Serializes the tree to {@code destination}, replacing any existing file.
     *
     * @param tree Finished document tree
     * @param destination Target .docx path; parent directories are created when missing
     * @throws DocumentWriteException if the file cannot be written
     */
    public void serialize(DocumentTree tree, Path destination) {
        Path target = destination.toAbsolutePath().normalize();
        Path temporary = null;

        try (XWPFDocument document = toDocx(tree)) {
            Files.createDirectories(target.getParent());
            temporary = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temporary)) {
                document.write(out);
            }
            moveIntoPlace(temporary, target);
            log.info("Document written - path: {}, paragraphs: {}", target, tree.getParagraphs().size());
        } catch (IOException e) {
            deleteQuietly(temporary);
            log.error("Failed to write document - path: {}", target, e);
            throw new DocumentWriteException(destination, e.getMessage(), e);
        }
    }

    XWPFDocument toDocx(DocumentTree tree) {
        StyleRegistry styles = tree.getStyles();
        XWPFDocument document = new XWPFDocument();

        applyPageLayout(document, styles.getPageLayout());
        applyMetadata(document, tree);
        registerStyles(document, styles);
        BigInteger bulletNumId = registerBulletNumbering(document, styles.get(StyleName.BULLET));

        for (DocumentParagraph paragraph : tree.getParagraphs()) {
            writeParagraph(document, paragraph, styles, bulletNumId);
        }
        return document;
    }

    private void applyPageLayout(XWPFDocument document, PageLayout layout) {
        CTBody body = document.getDocument().getBody();
        CTSectPr section = body.isSetSectPr() ? body.getSectPr() : body.addNewSectPr();

        CTPageSz size = section.isSetPgSz() ? section.getPgSz() : section.addNewPgSz();
        size.setW(twips(layout.getWidth()));
        size.setH(twips(layout.getHeight()));

        CTPageMar margins = section.isSetPgMar() ? section.getPgMar() : section.addNewPgMar();
        margins.setTop(twips(layout.getTopMargin()));
        margins.setBottom(twips(layout.getBottomMargin()));
        margins.setLeft(twips(layout.getLeftMargin()));
        margins.setRight(twips(layout.getRightMargin()));
    }

    private void applyMetadata(XWPFDocument document, DocumentTree tree) {
        POIXMLProperties.CoreProperties core = document.getProperties().getCoreProperties();
        core.setCreator(CREATOR);
        if (tree.getTitle() != null && !tree.getTitle().isBlank()) {
            core.setTitle(tree.getTitle());
        }
    }

    private void registerStyles(XWPFDocument document, StyleRegistry styles) {
        XWPFStyles documentStyles = document.createStyles();

        for (Map.Entry<StyleName, StyleDefinition> entry : styles.getStyles().entrySet()) {
            StyleName name = entry.getKey();
            StyleDefinition definition = entry.getValue();

            CTStyle style = CTStyle.Factory.newInstance();
            style.setStyleId(name.getStyleId());
            style.setType(STStyleType.PARAGRAPH);
            style.addNewName().setVal(name.getDisplayName());
            style.addNewQFormat();

            CTRPr runProperties = style.addNewRPr();
            applyTypeface(runProperties.addNewRFonts(), definition.getTypeface());
            BigInteger halfPoints = BigInteger.valueOf(Math.round(definition.getPointSize() * 2));
            runProperties.addNewSz().setVal(halfPoints);
            runProperties.addNewSzCs().setVal(halfPoints);
            if (definition.isBold()) {
                runProperties.addNewB();
            }

            CTPPrGeneral paragraphProperties = style.addNewPPr();
            CTSpacing spacing = paragraphProperties.addNewSpacing();
            spacing.setBefore(twips(definition.getSpaceBefore()));
            spacing.setAfter(twips(definition.getSpaceAfter()));
            spacing.setLine(BigInteger.valueOf(Math.round(definition.getLineSpacing() * LINE_UNITS_PER_SINGLE_SPACING)));
            spacing.setLineRule(STLineSpacingRule.AUTO);
            if (definition.getLeftIndent() != 0 || definition.getHangingIndent() != 0) {
                applyIndent(paragraphProperties.addNewInd(), definition);
            }
            if (definition.isJustified()) {
                paragraphProperties.addNewJc().setVal(STJc.BOTH);
            }

            documentStyles.addStyle(new XWPFStyle(style));
        }
    }

    private BigInteger registerBulletNumbering(XWPFDocument document, StyleDefinition bulletStyle) {
        CTAbstractNum abstractNum = CTAbstractNum.Factory.newInstance();
        abstractNum.setAbstractNumId(BigInteger.ZERO);

        CTLvl level = abstractNum.addNewLvl();
        level.setIlvl(BigInteger.ZERO);
        level.addNewStart().setVal(BigInteger.ONE);
        level.addNewNumFmt().setVal(STNumberFormat.BULLET);
        level.addNewLvlText().setVal(BULLET_GLYPH);
        level.addNewLvlJc().setVal(STJc.LEFT);
        applyIndent(level.addNewPPr().addNewInd(), bulletStyle);
        applyTypeface(level.addNewRPr().addNewRFonts(), bulletStyle.getTypeface());

        XWPFNumbering numbering = document.createNumbering();
        BigInteger abstractNumId = numbering.addAbstractNum(new XWPFAbstractNum(abstractNum));
        return numbering.addNum(abstractNumId);
    }

    private void writeParagraph(XWPFDocument document, DocumentParagraph paragraph,
                                StyleRegistry styles, BigInteger bulletNumId) {
        XWPFParagraph target = document.createParagraph();
        target.setStyle(paragraph.getStyle().getStyleId());
        target.setAlignment(toParagraphAlignment(paragraph.getAlignment()));

        if (paragraph.getStyle() == StyleName.BULLET) {
            target.setNumID(bulletNumId);
            target.setNumILvl(BigInteger.ZERO);
        }

        CTP ctp = target.getCTP();
        CTPPr properties = ctp.isSetPPr() ? ctp.getPPr() : ctp.addNewPPr();

        if (paragraph.isBottomBorder()) {
            CTPBdr borders = properties.isSetPBdr() ? properties.getPBdr() : properties.addNewPBdr();
            CTBorder bottom = borders.isSetBottom() ? borders.getBottom() : borders.addNewBottom();
            bottom.setVal(STBorder.SINGLE);
            bottom.setSz(BigInteger.valueOf(styles.getHeadingRule().width()));
            bottom.setSpace(BigInteger.valueOf(styles.getHeadingRule().spacing()));
            bottom.setColor("auto");
        }

        if (!paragraph.getTabStops().isEmpty()) {
            CTTabs tabs = properties.isSetTabs() ? properties.getTabs() : properties.addNewTabs();
            for (TabStop tabStop : paragraph.getTabStops()) {
                CTTabStop stop = tabs.addNewTab();
                stop.setVal(tabStop.getKind() == TabStop.Kind.RIGHT ? STTabJc.RIGHT : STTabJc.LEFT);
                stop.setPos(twips(tabStop.getPosition()));
            }
        }

        for (TextRun run : paragraph.getRuns()) {
            XWPFRun targetRun = target.createRun();
            if (run.isTab()) {
                targetRun.addTab();
                continue;
            }
            targetRun.setText(run.getText());
            if (run.isBold()) {
                targetRun.setBold(true);
            }
        }
    }

    private void applyTypeface(CTFonts fonts, String typeface) {
        fonts.setAscii(typeface);
        fonts.setHAnsi(typeface);
        fonts.setCs(typeface);
        fonts.setEastAsia(typeface);
    }

    private void applyIndent(CTInd indent, StyleDefinition definition) {
        indent.setLeft(twips(definition.getLeftIndent()));
        indent.setHanging(twips(definition.getHangingIndent()));
    }

    private ParagraphAlignment toParagraphAlignment(Alignment alignment) {
        return switch (alignment) {
            case CENTER -> ParagraphAlignment.CENTER;
            case JUSTIFY -> ParagraphAlignment.BOTH;
            case LEFT -> ParagraphAlignment.LEFT;
        };
    }

    private void moveIntoPlace(Path temporary, Path target) throws IOException {
        try {
            Files.move(temporary, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported, falling back to replace - path: {}", target);
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}", file, e);
        }
    }

    static BigInteger twips(double points) {
        return BigInteger.valueOf(Math.round(points * TWIPS_PER_POINT));
    }
}
