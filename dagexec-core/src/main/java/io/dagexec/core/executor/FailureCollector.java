package io.dagexec.core.executor;

import java.util.ArrayList;
import java.util.List;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * Collects failures of a single run in the order they happen.
 */
public class FailureCollector
{
    static final int HEADER_WIDTH = 80;

    private final List<FailureRecord> records = new ArrayList<>();

    public void append(String taskIdentity, String trace)
    {
        records.add(FailureRecord.of(taskIdentity, trace));
    }

    public boolean isEmpty()
    {
        return records.isEmpty();
    }

    public int size()
    {
        return records.size();
    }

    public List<FailureRecord> getRecords()
    {
        return ImmutableList.copyOf(records);
    }

    /**
     * Renders one block per failure: a header line with the task identity
     * centered in dashes, followed by the trace.
     */
    public String render()
    {
        StringBuilder sb = new StringBuilder();
        for (FailureRecord record : records) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(header(record.getTaskIdentity())).append('\n');
            sb.append(record.getTrace().trim()).append('\n');
        }
        return sb.toString();
    }

    static String header(String title)
    {
        String text = " " + title + " ";
        int fill = HEADER_WIDTH - text.length();
        if (fill <= 0) {
            return text;
        }
        int left = fill / 2;
        return Strings.repeat("-", left) + text + Strings.repeat("-", fill - left);
    }

    @Override
    public String toString()
    {
        return render();
    }
}
