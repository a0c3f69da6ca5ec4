package io.peerbench.bank.ffiec;

import io.peerbench.bank.error.ProtocolStateException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Transitions of the three-step web-form handshake:
 * GET the form, POST the date selection, POST the download button.
 * Every method is a pure function of its arguments.
 */
public final class BulkDownloadProtocol {
    public static final String VIEW_STATE = "__VIEWSTATE";
    public static final String EVENT_TARGET = "__EVENTTARGET";
    public static final String EVENT_ARGUMENT = "__EVENTARGUMENT";
    public static final String REPORT_FIELD = "ListBox1";
    public static final String DATE_FIELD = "DatesDropDownList";
    public static final String FORMAT_FIELD = "ExportFormatDropDownList";
    public static final String DOWNLOAD_BUTTON = "Download_0";
    public static final String REPORT_TYPE = "Reports of Condition and Income";

    private static final DateTimeFormatter FORM_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.US);

    private BulkDownloadProtocol() {}

    /** Reads the initial form; the state stays INIT but now carries the page tokens. */
    public static BulkSessionState onFormPage(BulkSessionState state, PageResponse page) {
        require(state, BulkSessionState.Phase.INIT);
        Map<String, String> tokens = tokens(page, "form page");
        return new BulkSessionState(BulkSessionState.Phase.INIT, state.targetDate(), tokens, null, List.of(), null);
    }

    public static Map<String, String> dateSelectionPayload(BulkSessionState state) {
        require(state, BulkSessionState.Phase.INIT);
        if (!state.tokens().containsKey(VIEW_STATE)) {
            throw new ProtocolStateException("date selection attempted before the form page was read");
        }
        Map<String, String> form = new LinkedHashMap<>(state.tokens());
        form.put(EVENT_TARGET, DATE_FIELD);
        form.put(EVENT_ARGUMENT, "");
        form.put(REPORT_FIELD, REPORT_TYPE);
        form.put(DATE_FIELD, FORM_DATE.format(state.targetDate()));
        form.put(FORMAT_FIELD, "TXT");
        return form;
    }

    public static BulkSessionState onDateSelected(BulkSessionState state, PageResponse page) {
        require(state, BulkSessionState.Phase.INIT);
        Map<String, String> tokens = tokens(page, "date selection");
        return new BulkSessionState(BulkSessionState.Phase.DATE_SELECTED, state.targetDate(), tokens, null, List.of(), null);
    }

    public static Map<String, String> downloadPayload(BulkSessionState state) {
        require(state, BulkSessionState.Phase.DATE_SELECTED);
        Map<String, String> form = new LinkedHashMap<>(state.tokens());
        form.remove(EVENT_TARGET);
        form.put(REPORT_FIELD, REPORT_TYPE);
        form.put(DATE_FIELD, FORM_DATE.format(state.targetDate()));
        form.put(FORMAT_FIELD, "TXT");
        form.put(DOWNLOAD_BUTTON, "Download");
        return form;
    }

    /**
     * @throws ProtocolStateException carrying the body when the answer is not an archive
     */
    public static BulkSessionState onDownload(BulkSessionState state, PageResponse page) {
        require(state, BulkSessionState.Phase.DATE_SELECTED);
        if (page.status() != 200) {
            throw new ProtocolStateException("download returned HTTP " + page.status(), page.body());
        }
        if (!isArchive(page)) {
            throw new ProtocolStateException("download returned " + describe(page) + " instead of an archive", page.body());
        }
        return new BulkSessionState(BulkSessionState.Phase.DOWNLOADED, state.targetDate(), state.tokens(), page.body(), List.of(), null);
    }

    public static BulkSessionState onParsed(BulkSessionState state, List<BulkObservation> observations) {
        require(state, BulkSessionState.Phase.DOWNLOADED);
        return new BulkSessionState(BulkSessionState.Phase.PARSED, state.targetDate(), Map.of(), null, observations, null);
    }

    public static BulkSessionState failed(BulkSessionState state, String reason) {
        return new BulkSessionState(BulkSessionState.Phase.FAILED, state.targetDate(), Map.of(), null, List.of(), reason);
    }

    static boolean isArchive(PageResponse page) {
        byte[] b = page.body();
        if (b.length >= 2 && b[0] == 'P' && b[1] == 'K') return true;
        String type = page.contentType().toLowerCase(Locale.ROOT);
        return type.contains("zip") || type.contains("octet-stream");
    }

    static Map<String, String> hiddenFields(String html) {
        Document doc = Jsoup.parse(html);
        Map<String, String> out = new LinkedHashMap<>();
        for (Element input : doc.select("input[type=hidden]")) {
            String name = input.attr("name");
            if (!name.isEmpty()) out.put(name, input.attr("value"));
        }
        return out;
    }

    private static Map<String, String> tokens(PageResponse page, String step) {
        if (page.status() != 200) {
            throw new ProtocolStateException(step + " returned HTTP " + page.status(), page.body());
        }
        Map<String, String> tokens = hiddenFields(page.text());
        if (!tokens.containsKey(VIEW_STATE)) {
            throw new ProtocolStateException(step + " carried no " + VIEW_STATE, page.body());
        }
        return tokens;
    }

    private static void require(BulkSessionState state, BulkSessionState.Phase expected) {
        if (state.phase() != expected) {
            throw new IllegalStateException("expected phase " + expected + " but was " + state.phase());
        }
    }

    private static String describe(PageResponse page) {
        return page.contentType().isEmpty() ? "an untyped body" : "'" + page.contentType() + "'";
    }
}
