package com.bbthechange.chatpolls.model;

import com.bbthechange.chatpolls.client.ConnectionState;
import com.bbthechange.chatpolls.dto.PollAnswerCountPayload;
import com.bbthechange.chatpolls.dto.PollAnswerPayload;
import com.bbthechange.chatpolls.dto.PollCreateRequest;
import com.bbthechange.chatpolls.dto.PollMediaPayload;
import com.bbthechange.chatpolls.dto.PollPayload;
import com.bbthechange.chatpolls.dto.PollResultsPayload;
import com.bbthechange.chatpolls.exception.UnattachedResourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * A message poll: a question, its answers, an expiry and, once the platform reports them, vote tallies.
 *
 * A poll built with the constructor is a draft: answers can be added until it is sent, it is never
 * finalized and it has no tallies. A poll read from a message payload is attached to that message
 * and can list voters or be ended. Fresh data arrives as a new instance, never by mutating this one.
 */
public class Poll {

    private static final Logger logger = LoggerFactory.getLogger(Poll.class);

    private final String question;
    private final int duration;
    private final boolean multiselect;
    private final PollLayoutType layoutType;
    private final List<PollAnswer> answers = new ArrayList<>();

    private Message message;
    private ConnectionState state;
    private OffsetDateTime expiry;
    private boolean finalized;
    private List<PollAnswerCount> counts;

    /**
     * @param question up to 300 characters
     * @param duration hours until the poll closes: 1, 4, 8, 24, 72 or 168
     */
    public Poll(String question, int duration) {
        this(question, duration, false, PollLayoutType.DEFAULT);
    }

    public Poll(String question, int duration, boolean multiselect, PollLayoutType layoutType) {
        this.question = question;
        this.duration = duration;
        this.multiselect = multiselect;
        this.layoutType = layoutType;
        this.expiry = OffsetDateTime.now(ZoneOffset.UTC).plusHours(duration);
    }

    /**
     * Rebuild a poll received inside a message payload.
     * Inbound polls carry an expiry instead of a duration, so the duration reads as 1.
     *
     * @param payload poll section of the message payload
     * @param message message the poll belongs to
     * @param state session used for voter lookups and ending the poll
     */
    public static Poll fromPayload(PollPayload payload, Message message, ConnectionState state) {
        boolean multiselect = Boolean.TRUE.equals(payload.getAllowMultiselect());
        PollLayoutType layoutType = PollLayoutType.fromValue(
                payload.getLayoutType() != null ? payload.getLayoutType() : PollLayoutType.DEFAULT.getValue());

        Poll poll = new Poll(payload.getQuestion().getText(), 1, multiselect, layoutType);
        if (payload.getAnswers() != null) {
            for (PollAnswerPayload answer : payload.getAnswers()) {
                poll.answers.add(PollAnswer.fromPayload(answer, message));
            }
        }
        poll.message = message;
        poll.state = state;
        poll.expiry = parseExpiry(payload.getExpiry());

        PollResultsPayload results = payload.getResults();
        if (results != null) {
            poll.finalized = results.isFinalized();
            List<PollAnswerCountPayload> answerCounts = results.getAnswerCounts() != null
                    ? results.getAnswerCounts()
                    : List.of();
            poll.counts = answerCounts.stream()
                    .map(count -> new PollAnswerCount(state, message, count))
                    .collect(Collectors.toList());
        }
        return poll;
    }

    /**
     * ISO 8601 expiry; a timestamp without an offset is read as UTC.
     */
    static OffsetDateTime parseExpiry(String expiry) {
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                expiry, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime) {
            return (OffsetDateTime) parsed;
        }
        return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
    }

    /**
     * Body to submit with a new message. Answer ids are left out; the platform assigns them.
     */
    public PollCreateRequest toPayload() {
        List<PollAnswerPayload> answerPayloads = answers.stream()
                .map(answer -> PollAnswerPayload.builder().pollMedia(answer.toPayload()).build())
                .collect(Collectors.toList());

        return PollCreateRequest.builder()
                .allowMultiselect(multiselect)
                .question(PollMediaPayload.builder().text(question).build())
                .duration(duration)
                .layoutType(layoutType.getValue())
                .answers(answerPayloads)
                .build();
    }

    public String getQuestion() {
        return question;
    }

    public int getDuration() {
        return duration;
    }

    public boolean isMultiselect() {
        return multiselect;
    }

    public PollLayoutType getLayoutType() {
        return layoutType;
    }

    /**
     * Computed from the duration for drafts, taken from the payload for received polls.
     */
    public OffsetDateTime getExpiry() {
        return expiry;
    }

    /**
     * @return the owning message, or null for a draft
     */
    public Message getMessage() {
        return message;
    }

    /**
     * @return a copy of the answers in display order
     */
    public List<PollAnswer> getAnswers() {
        return new ArrayList<>(answers);
    }

    /**
     * @return a copy of the tallies, or empty for drafts and polls received without results
     */
    public Optional<List<PollAnswerCount>> getAnswerCounts() {
        if (counts == null || counts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ArrayList<>(counts));
    }

    public Optional<PollAnswerCount> getAnswerCount(int answerId) {
        if (counts == null) {
            return Optional.empty();
        }
        return counts.stream()
                .filter(count -> count.getId() == answerId)
                .findFirst();
    }

    /**
     * Sum of all reported tallies, 0 when there are none.
     */
    public int totalVotes() {
        if (counts == null) {
            return 0;
        }
        return counts.stream().mapToInt(PollAnswerCount::getCount).sum();
    }

    /**
     * Always false unless this poll was read from a message whose results are final.
     */
    public boolean isFinalized() {
        return finalized;
    }

    public Poll addAnswer(String text) {
        return addAnswer(text, (PartialEmoji) null);
    }

    /**
     * Append an answer. Its id is its 1-based position.
     *
     * @param text up to 55 characters
     * @param emoji emoji shown next to the text, or null
     * @return this poll
     */
    public Poll addAnswer(String text, PartialEmoji emoji) {
        answers.add(PollAnswer.fromParams(answers.size() + 1, text, emoji, message));
        return this;
    }

    /**
     * @param emoji unicode emoji or custom emoji markup, or null
     */
    public Poll addAnswer(String text, String emoji) {
        answers.add(PollAnswer.fromParams(answers.size() + 1, text, emoji, message));
        return this;
    }

    /**
     * Look an answer up by id, which is its 1-based position in the poll.
     *
     * @return the answer, or empty when no answer sits at that position
     */
    public Optional<PollAnswer> getAnswer(int id) {
        if (id > answers.size()) {
            return Optional.empty();
        }
        try {
            return Optional.of(answers.get(id - 1));
        } catch (IndexOutOfBoundsException e) {
            logger.debug("No answer at position {} of poll '{}'", id, question);
            return Optional.empty();
        }
    }

    /**
     * End the poll now.
     *
     * The returned message carries the final results; this instance is left unchanged.
     *
     * @throws UnattachedResourceException if the poll has no message
     */
    public CompletableFuture<Message> end() {
        if (message == null || state == null) {
            throw new UnattachedResourceException(
                    "This method can only be called when a message is present, try using this via Message.getPoll().end()");
        }

        Message original = message;
        return state.getHttp()
                .endPoll(original.getChannelId(), original.getId())
                .thenApply(payload -> Message.fromPayload(payload, original.getChannelId(), state));
    }

    @Override
    public String toString() {
        return question;
    }
}
