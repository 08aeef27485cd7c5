package de.alive.otpfetch.service;

import de.alive.otpfetch.domain.CandidateMessage;
import de.alive.otpfetch.domain.FetchRequest;
import de.alive.otpfetch.domain.OtpCandidate;
import de.alive.otpfetch.exception.MailConnectionException;
import de.alive.otpfetch.exception.OtpParseException;
import de.alive.otpfetch.infrastructure.EmailContentExtractor;
import de.alive.otpfetch.infrastructure.IConnection;
import de.alive.otpfetch.parser.MessageParser;
import de.alive.otpfetch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import javax.mail.FetchProfile;
import javax.mail.Flags;
import javax.mail.Folder;
import javax.mail.FolderClosedException;
import javax.mail.FolderNotFoundException;
import javax.mail.Message;
import javax.mail.MessagingException;
import javax.mail.StoreClosedException;
import javax.mail.UIDFolder;
import javax.mail.search.AndTerm;
import javax.mail.search.ComparisonTerm;
import javax.mail.search.FlagTerm;
import javax.mail.search.FromStringTerm;
import javax.mail.search.ReceivedDateTerm;
import javax.mail.search.RecipientStringTerm;
import javax.mail.search.SearchTerm;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;

/**
 * Looks for unread OTP mails in one folder over a leased connection. Folders are opened read-only and
 * message bodies are fetched with peek, so nothing on the server changes.
 */
@Slf4j
public class FolderScanner {

    @NotNull
    private final EmailContentExtractor contentExtractor;
    @NotNull
    private final MessageParser parser;
    private final int scanLimit;
    private final boolean recipientFilterEnabled;
    @NotNull
    private final Duration maxMessageAge;
    @NotNull
    private final Clock clock;

    public FolderScanner(@NotNull EmailContentExtractor contentExtractor, @NotNull MessageParser parser,
                         int scanLimit, boolean recipientFilterEnabled) {
        this(contentExtractor, parser, scanLimit, recipientFilterEnabled, Duration.ZERO, Clock.systemUTC());
    }

    /**
     * @param maxMessageAge only mail received within this period is searched; zero searches everything
     */
    public FolderScanner(@NotNull EmailContentExtractor contentExtractor, @NotNull MessageParser parser,
                         int scanLimit, boolean recipientFilterEnabled, @NotNull Duration maxMessageAge,
                         @NotNull Clock clock) {
        if (scanLimit <= 0) {
            throw new IllegalArgumentException("Scan limit must be positive");
        }
        if (maxMessageAge.isNegative()) {
            throw new IllegalArgumentException("Max message age cannot be negative");
        }
        this.contentExtractor = contentExtractor;
        this.parser = parser;
        this.scanLimit = scanLimit;
        this.recipientFilterEnabled = recipientFilterEnabled;
        this.maxMessageAge = maxMessageAge;
        this.clock = clock;
    }

    /**
     * Candidates in {@code folderName} that carry a code. An empty list means no match this round.
     *
     * @throws MailConnectionException {@code NETWORK_ERROR} when the connection broke during the scan
     */
    @NotNull
    public List<OtpCandidate> scan(@NotNull IConnection connection, @NotNull String folderName,
                                   @NotNull FetchRequest request) throws MailConnectionException {
        List<CandidateMessage> messages = fetchCandidates(connection, folderName, request);
        List<OtpCandidate> candidates = new ArrayList<>();

        for (CandidateMessage message : messages) {
            try {
                candidates.add(OtpCandidate.of(parser.parse(message), message));
            } catch (OtpParseException e) {
                log.debug("Message {} in {} skipped: {}", message.uid(), folderName, e.getMessage());
            }
        }

        if (!candidates.isEmpty()) {
            log.info("{} {} code candidate(s) in {} for {}",
                    LogUtils.KEY_EMOJI, candidates.size(), folderName, LogUtils.maskEmail(request.targetRecipient()));
        }
        return candidates;
    }

    /**
     * Unread messages from the expected sender, newest {@code scanLimit} only, before parsing.
     */
    @NotNull
    public List<CandidateMessage> fetchCandidates(@NotNull IConnection connection, @NotNull String folderName,
                                                  @NotNull FetchRequest request) throws MailConnectionException {
        Folder folder = null;
        try {
            folder = connection.getStore().getFolder(folderName);
            if (!folder.exists()) {
                log.warn("{} Mail folder not found: {}", LogUtils.WARNING_EMOJI, folderName);
                return List.of();
            }

            folder.open(Folder.READ_ONLY);
            log.debug("{} Searching {} on connection {}", LogUtils.SEARCH_EMOJI, folderName, connection.getId());

            Message[] matches = folder.search(buildSearchTerm(request));
            Message[] newest = newest(matches);
            if (newest.length == 0) {
                log.debug("No unread mail in {} for {}", folderName, LogUtils.maskEmail(request.targetRecipient()));
                return List.of();
            }

            FetchProfile fetchProfile = new FetchProfile();
            fetchProfile.add(FetchProfile.Item.ENVELOPE);
            fetchProfile.add(FetchProfile.Item.FLAGS);
            fetchProfile.add(UIDFolder.FetchProfileItem.UID);
            folder.fetch(newest, fetchProfile);

            return toCandidates(folder, folderName, newest, request);

        } catch (FolderNotFoundException e) {
            log.warn("{} Mail folder not found: {}", LogUtils.WARNING_EMOJI, folderName);
            return List.of();
        } catch (FolderClosedException | StoreClosedException e) {
            throw MailConnectionException.network("Connection lost while scanning " + folderName, e);
        } catch (MessagingException e) {
            if (!connection.isConnected()) {
                throw MailConnectionException.network("Connection lost while scanning " + folderName, e);
            }
            log.warn("{} Scan of {} failed: {}", LogUtils.WARNING_EMOJI, folderName, e.getMessage());
            return List.of();
        } finally {
            closeFolder(folder);
        }
    }

    public int getScanLimit() {
        return scanLimit;
    }

    SearchTerm buildSearchTerm(@NotNull FetchRequest request) {
        List<SearchTerm> terms = new ArrayList<>();
        terms.add(new FlagTerm(new Flags(Flags.Flag.SEEN), false));
        terms.add(new FromStringTerm(request.senderFilter()));
        if (recipientFilterEnabled) {
            terms.add(new RecipientStringTerm(Message.RecipientType.TO, request.targetRecipient()));
        }
        if (!maxMessageAge.isZero()) {
            // IMAP SINCE compares whole days
            Date since = Date.from(clock.instant().minus(maxMessageAge));
            terms.add(new ReceivedDateTerm(ComparisonTerm.GE, since));
        }
        return new AndTerm(terms.toArray(new SearchTerm[0]));
    }

    private Message[] newest(Message[] matches) {
        if (matches == null || matches.length == 0) {
            return new Message[0];
        }
        if (matches.length <= scanLimit) {
            return matches;
        }
        // search results come in ascending sequence order
        return Arrays.copyOfRange(matches, matches.length - scanLimit, matches.length);
    }

    private List<CandidateMessage> toCandidates(Folder folder, String folderName, Message[] messages,
                                                FetchRequest request) throws MessagingException {
        String expectedSender = EmailContentExtractor.normalizeAddress(request.senderFilter());
        String expectedRecipient = EmailContentExtractor.normalizeAddress(request.targetRecipient());
        List<CandidateMessage> candidates = new ArrayList<>();

        for (Message message : messages) {
            if (message == null) {
                continue;
            }
            try {
                CandidateMessage candidate = contentExtractor.extract(message, folderName, uidOf(folder, message));
                if (candidate.seen()) {
                    continue;
                }
                if (!EmailContentExtractor.normalizeAddress(candidate.from()).contains(expectedSender)) {
                    continue;
                }
                if (recipientFilterEnabled && candidate.recipients().stream()
                        .noneMatch(recipient -> recipient.contains(expectedRecipient))) {
                    continue;
                }
                candidates.add(candidate);
            } catch (OtpParseException e) {
                log.debug("Message in {} could not be read: {}", folderName, e.getMessage());
            }
        }
        return candidates;
    }

    private long uidOf(Folder folder, Message message) throws MessagingException {
        if (folder instanceof UIDFolder) {
            return ((UIDFolder) folder).getUID(message);
        }
        return message.getMessageNumber();
    }

    private void closeFolder(@Nullable Folder folder) {
        if (folder != null && folder.isOpen()) {
            try {
                folder.close(false);
            } catch (MessagingException e) {
                log.debug("Failed to close folder {}: {}", folder.getFullName(), e.getMessage());
            }
        }
    }
}
