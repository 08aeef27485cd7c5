package de.alive.otpfetch.infrastructure;

import de.alive.otpfetch.domain.CandidateMessage;
import de.alive.otpfetch.exception.OtpParseException;
import de.alive.otpfetch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import javax.mail.Address;
import javax.mail.BodyPart;
import javax.mail.Flags;
import javax.mail.Message;
import javax.mail.MessagingException;
import javax.mail.Multipart;
import javax.mail.Part;
import javax.mail.internet.AddressException;
import javax.mail.internet.InternetAddress;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
public class EmailContentExtractor {

    private static final int MAX_CONTENT_LENGTH = 500_000;
    private static final int MAX_SUBJECT_LENGTH = 1000;
    private static final int MAX_NESTING_DEPTH = 10;

    private static final Pattern EMAIL_PATTERN = Pattern.compile("([a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,})");
    private static final Pattern SCRIPT_OR_STYLE = Pattern.compile("(?is)<(script|style)[^>]*>.*?</\\1>");
    private static final Pattern LINE_BREAK_TAGS = Pattern.compile("(?i)<(br|/p|/div|/tr|/h[1-6])[^>]*>");
    private static final Pattern TAG = Pattern.compile("<[^>]+>");

    /**
     * Reads subject, sender, recipients, date, seen flag and a plain-text body from {@code message}.
     */
    @NotNull
    public CandidateMessage extract(@NotNull Message message, @NotNull String folderName, long uid)
            throws OtpParseException {
        try {
            String subject = extractSubject(message).orElse("");
            String from = extractSender(message).orElse("");
            List<String> recipients = extractRecipients(message);
            Instant receivedAt = extractDate(message);
            boolean seen = message.isSet(Flags.Flag.SEEN);
            String body = extractBody(message, uid);

            return new CandidateMessage(folderName, uid, subject, body, from, recipients, receivedAt, seen);
        } catch (MessagingException e) {
            log.debug("{} Failed to extract message {} in {}: {}",
                    LogUtils.WARNING_EMOJI, uid, folderName, e.getMessage());
            throw new OtpParseException(
                    "Message extraction failed: " + e.getMessage(),
                    folderName,
                    uid,
                    OtpParseException.ParseStage.CONTENT_EXTRACTION,
                    e
            );
        }
    }

    /**
     * Lower-cased bare address of {@code from}, e.g. {@code "Service <No-Reply@x.com>"} becomes {@code "no-reply@x.com"}.
     */
    @NotNull
    public static String normalizeAddress(String from) {
        if (from == null || from.trim().isEmpty()) {
            return "";
        }

        try {
            InternetAddress[] addresses = InternetAddress.parse(from);
            if (addresses.length > 0 && addresses[0].getAddress() != null) {
                return addresses[0].getAddress().toLowerCase(Locale.ROOT).trim();
            }
        } catch (AddressException e) {
            Matcher matcher = EMAIL_PATTERN.matcher(from);
            if (matcher.find()) {
                return matcher.group(1).toLowerCase(Locale.ROOT).trim();
            }
        }

        return from.toLowerCase(Locale.ROOT).trim();
    }

    /**
     * Crude HTML to text: drops scripts, styles and tags and decodes the common entities.
     */
    @NotNull
    public static String htmlToText(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String text = SCRIPT_OR_STYLE.matcher(html).replaceAll(" ");
        text = LINE_BREAK_TAGS.matcher(text).replaceAll("\n");
        text = TAG.matcher(text).replaceAll(" ");
        return text
                .replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&amp;", "&");
    }

    private String extractBody(Message message, long uid) {
        try {
            String content = extractText(message, 0);
            if (content.length() > MAX_CONTENT_LENGTH) {
                content = content.substring(0, MAX_CONTENT_LENGTH);
            }
            return content;
        } catch (IOException | MessagingException e) {
            // subject may still carry the code
            log.debug("Body extraction failed for message {}: {}", uid, e.getMessage());
            return "";
        }
    }

    private String extractText(Part part, int depth) throws MessagingException, IOException {
        if (depth > MAX_NESTING_DEPTH) {
            return "";
        }

        if (part.isMimeType("text/plain")) {
            return String.valueOf(part.getContent());
        }
        if (part.isMimeType("text/html")) {
            return htmlToText(String.valueOf(part.getContent()));
        }
        if (part.isMimeType("multipart/alternative")) {
            return extractAlternative((Multipart) part.getContent(), depth);
        }
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart bodyPart = multipart.getBodyPart(i);
                if (Part.ATTACHMENT.equalsIgnoreCase(bodyPart.getDisposition())) {
                    continue;
                }
                text.append(extractText(bodyPart, depth + 1)).append('\n');
            }
            return text.toString();
        }
        if (part.isMimeType("message/rfc822")) {
            return extractText((Part) part.getContent(), depth + 1);
        }

        Object content = part.getContent();
        return content instanceof String ? (String) content : "";
    }

    private String extractAlternative(Multipart multipart, int depth) throws MessagingException, IOException {
        String html = null;
        for (int i = 0; i < multipart.getCount(); i++) {
            BodyPart bodyPart = multipart.getBodyPart(i);
            if (bodyPart.isMimeType("text/plain")) {
                return String.valueOf(bodyPart.getContent());
            }
            if (html == null) {
                html = extractText(bodyPart, depth + 1);
            }
        }
        return html == null ? "" : html;
    }

    private Optional<String> extractSubject(Message message) throws MessagingException {
        String subject = message.getSubject();
        if (subject == null || subject.trim().isEmpty()) {
            return Optional.empty();
        }
        if (subject.length() > MAX_SUBJECT_LENGTH) {
            subject = subject.substring(0, MAX_SUBJECT_LENGTH);
        }
        return Optional.of(subject.trim());
    }

    private Optional<String> extractSender(Message message) throws MessagingException {
        Address[] from = message.getFrom();
        if (from != null && from.length > 0 && from[0] != null) {
            return Optional.of(from[0].toString());
        }
        return Optional.empty();
    }

    private List<String> extractRecipients(Message message) throws MessagingException {
        List<String> recipients = new ArrayList<>();
        Address[] addresses = message.getAllRecipients();
        if (addresses != null) {
            for (Address address : addresses) {
                String normalized = normalizeAddress(address.toString());
                if (!normalized.isEmpty()) {
                    recipients.add(normalized);
                }
            }
        }
        return recipients;
    }

    private Instant extractDate(Message message) throws MessagingException {
        Date date = message.getReceivedDate();
        if (date == null) {
            date = message.getSentDate();
        }
        // undated mail ranks after every dated candidate
        return date == null ? Instant.MAX : date.toInstant();
    }
}
