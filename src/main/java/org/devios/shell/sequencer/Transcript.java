package org.devios.shell.sequencer;

import org.devios.shell.dto.ResultRecord;
import org.devios.shell.dto.TranscriptEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * 终端输出历史（展示层看到的全部内容）。
 * <p>
 * 这是唯一会被多个执行上下文访问的共享可变结构：命令线程追加新条目，定时步骤追加到最后一条。
 * 所有读写都在同一把锁内完成。
 */
public class Transcript {

    private final List<MutableEntry> entries = new ArrayList<>();

    public synchronized void addEntry(String command, List<ResultRecord> records) {
        entries.add(new MutableEntry(command, records));
    }

    /**
     * 追加到最后一条；输出历史为空时新建一条无命令的条目。
     */
    public synchronized void appendToTail(List<ResultRecord> records) {
        if (entries.isEmpty()) {
            entries.add(new MutableEntry("", records));
            return;
        }
        entries.get(entries.size() - 1).records.addAll(records);
    }

    /**
     * 用新内容替换最后一条的结果（进度条刷新）。
     */
    public synchronized void replaceTail(List<ResultRecord> records) {
        if (entries.isEmpty()) {
            entries.add(new MutableEntry("", records));
            return;
        }
        MutableEntry tail = entries.get(entries.size() - 1);
        tail.records.clear();
        tail.records.addAll(records);
    }

    public synchronized void clear() {
        entries.clear();
    }

    /**
     * 清空后只保留一条无命令的横幅条目。
     */
    public synchronized void resetTo(List<ResultRecord> banner) {
        entries.clear();
        entries.add(new MutableEntry("", banner));
    }

    public synchronized List<TranscriptEntry> snapshot() {
        List<TranscriptEntry> copy = new ArrayList<>(entries.size());
        for (MutableEntry entry : entries) {
            copy.add(new TranscriptEntry(entry.command, entry.records));
        }
        return copy;
    }

    public synchronized List<ResultRecord> tailRecords() {
        if (entries.isEmpty()) {
            return List.of();
        }
        return List.copyOf(entries.get(entries.size() - 1).records);
    }

    public synchronized int size() {
        return entries.size();
    }

    private static final class MutableEntry {
        private final String command;
        private final List<ResultRecord> records;

        private MutableEntry(String command, List<ResultRecord> records) {
            this.command = command;
            this.records = new ArrayList<>(records);
        }
    }
}
