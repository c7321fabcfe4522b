package de.mirkosertic.mcp.blobsearch.extract;

import org.apache.tika.exception.TikaException;
import org.apache.tika.exception.WriteLimitReachedException;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Extracts text with Apache Tika's auto-detecting parser.
 * Covers plain text, CSV, PDF, Office documents and (when a Tesseract binary is installed) images.
 */
public class TikaTextExtractor implements TextExtractor {

    private static final Logger logger = LoggerFactory.getLogger(TikaTextExtractor.class);

    private final Parser parser;
    private final int writeLimit;

    /**
     * @param maxContentLength maximum number of characters to keep, -1 or 0 for unlimited
     */
    public TikaTextExtractor(final long maxContentLength) {
        this.parser = new AutoDetectParser();
        this.writeLimit = maxContentLength <= 0 ? -1 : (int) Math.min(maxContentLength, Integer.MAX_VALUE);
    }

    @Override
    public String extract(final byte[] content, final String fileName) {
        if (content == null || content.length == 0) {
            return "";
        }

        final Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);

        final BodyContentHandler handler = new BodyContentHandler(writeLimit);
        final ParseContext context = new ParseContext();
        context.set(Parser.class, parser);

        try (final InputStream stream = TikaInputStream.get(content)) {
            parser.parse(stream, handler, metadata, context);
        } catch (final SAXException | IOException | TikaException e) {
            // Hitting the write limit surfaces as an exception, the text collected so far is kept
            if (!WriteLimitReachedException.isWriteLimitReached(e)) {
                logger.warn("Failed to extract text from {}: {}", fileName, e.getMessage());
                return "";
            }
            logger.debug("Content of {} truncated at {} characters", fileName, writeLimit);
        } catch (final RuntimeException e) {
            // Some parsers fail with unchecked exceptions on corrupt input
            logger.warn("Parser crashed on {}", fileName, e);
            return "";
        }

        final String text = TextNormalizer.normalize(handler.toString());
        logger.debug("Extracted {} characters from {} ({})", text.length(), fileName,
                metadata.get(Metadata.CONTENT_TYPE));
        return text;
    }
}
