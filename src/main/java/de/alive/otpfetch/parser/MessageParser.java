package de.alive.otpfetch.parser;

import de.alive.otpfetch.domain.CandidateMessage;
import de.alive.otpfetch.exception.OtpParseException;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.util.Optional;

@Slf4j
public class MessageParser {

    private static final int MAX_TEXT_LENGTH = 100_000;

    @NotNull
    private final OtpExtractionRule rule;

    public MessageParser(@NotNull OtpExtractionRule rule) {
        this.rule = rule;
    }

    /**
     * Applies the extraction rule to the subject, then to the body.
     *
     * @throws OtpParseException when neither contains a code
     */
    @NotNull
    public String parse(@NotNull CandidateMessage message) throws OtpParseException {
        Optional<String> fromSubject = rule.extract(normalize(message.subject()));
        if (fromSubject.isPresent()) {
            return fromSubject.get();
        }

        Optional<String> fromBody = rule.extract(normalize(message.body()));
        if (fromBody.isPresent()) {
            return fromBody.get();
        }

        throw new OtpParseException(
                String.format("No code matching %s in message %d", rule.getName(), message.uid()),
                message.folder(),
                message.uid(),
                OtpParseException.ParseStage.TOKEN_EXTRACTION
        );
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String limited = text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) : text;
        return limited
                .replace('\u00A0', ' ')
                .replaceAll("\\s+", " ")
                .trim();
    }

    @NotNull
    public OtpExtractionRule getRule() {
        return rule;
    }
}
