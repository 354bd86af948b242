package uk.gegc.mcqgen.features.mcq.infra.parser;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.mcqgen.features.mcq.application.McqParser;
import uk.gegc.mcqgen.features.mcq.domain.McqOption;
import uk.gegc.mcqgen.features.mcq.domain.McqRecord;
import uk.gegc.mcqgen.features.mcq.domain.McqResultSet;
import uk.gegc.mcqgen.features.mcq.domain.OptionLabel;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented parser for {@code ## MCQ} delimited responses.
 * <p>
 * Within a block the first {@code Question:} line opens the record. Options are
 * the first {@code A)} to {@code D)} lines after it, in any order, and the
 * answer comes from the first {@code Correct Answer:} line.
 */
@Component
@Slf4j
public class LineBasedMcqParser implements McqParser {

    private static final Pattern BLOCK_SPLITTER = Pattern.compile(Pattern.quote(BLOCK_DELIMITER));
    private static final Pattern LINE_SPLITTER = Pattern.compile("\\R");
    private static final String QUESTION_PREFIX = "Question:";
    private static final String ANSWER_PREFIX = "Correct Answer:";

    // Accepts "B", "b", "B)", "(B)", "[B]", "B.", "B: text", "B) text"
    private static final Pattern ANSWER_LETTER =
            Pattern.compile("^[(\\[]?\\s*([A-Da-d])\\s*(?:[)\\].:]|\\s|$)");

    @Override
    public McqResultSet parse(String rawResponse) {
        if (rawResponse == null || rawResponse.isBlank()) {
            log.debug("Nothing to parse: response is blank");
            return McqResultSet.empty();
        }

        List<McqRecord> records = new ArrayList<>();
        int discarded = 0;
        int blockNumber = 0;

        for (String block : BLOCK_SPLITTER.split(rawResponse, -1)) {
            if (block.isBlank()) {
                continue;
            }
            blockNumber++;
            Optional<McqRecord> record = parseBlock(block.strip(), blockNumber);
            if (record.isPresent()) {
                records.add(record.get());
            } else {
                discarded++;
            }
        }

        log.debug("Parsed {} records from {} blocks ({} discarded)", records.size(), blockNumber, discarded);
        return new McqResultSet(records, discarded);
    }

    private Optional<McqRecord> parseBlock(String block, int blockNumber) {
        String[] lines = LINE_SPLITTER.split(block);

        int questionLine = -1;
        String question = null;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].stripLeading();
            if (line.startsWith(QUESTION_PREFIX)) {
                questionLine = i;
                question = line.substring(QUESTION_PREFIX.length()).strip();
                break;
            }
        }
        if (questionLine < 0) {
            return discard(blockNumber, "no 'Question:' line");
        }
        if (question.isEmpty()) {
            return discard(blockNumber, "question text is empty");
        }

        Map<OptionLabel, String> optionTexts = new EnumMap<>(OptionLabel.class);
        for (int i = questionLine + 1; i < lines.length; i++) {
            String line = lines[i].stripLeading();
            for (OptionLabel label : OptionLabel.values()) {
                if (!optionTexts.containsKey(label) && line.startsWith(label.prefix())) {
                    optionTexts.put(label, line.substring(label.prefix().length()).strip());
                    break;
                }
            }
        }

        List<McqOption> options = new ArrayList<>(OptionLabel.values().length);
        for (OptionLabel label : OptionLabel.values()) {
            String text = optionTexts.get(label);
            if (text == null) {
                return discard(blockNumber, "option " + label + " is missing");
            }
            if (text.isEmpty()) {
                return discard(blockNumber, "option " + label + " is empty");
            }
            options.add(new McqOption(label, text));
        }

        String answer = null;
        for (String rawLine : lines) {
            String line = rawLine.stripLeading();
            if (line.startsWith(ANSWER_PREFIX)) {
                answer = line.substring(ANSWER_PREFIX.length()).strip();
                break;
            }
        }
        if (answer == null) {
            return discard(blockNumber, "no 'Correct Answer:' line");
        }
        Optional<OptionLabel> correctLabel = normalizeAnswer(answer);
        if (correctLabel.isEmpty()) {
            return discard(blockNumber, "unrecognised correct answer '" + answer + "'");
        }

        return Optional.of(new McqRecord(question, options, correctLabel.get(), block));
    }

    static Optional<OptionLabel> normalizeAnswer(String answer) {
        Matcher matcher = ANSWER_LETTER.matcher(answer.strip());
        if (!matcher.find()) {
            return Optional.empty();
        }
        return OptionLabel.fromLetter(matcher.group(1).charAt(0));
    }

    private Optional<McqRecord> discard(int blockNumber, String reason) {
        log.warn("Discarding MCQ block {}: {}", blockNumber, reason);
        return Optional.empty();
    }
}
