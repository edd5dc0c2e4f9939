package com.my.reminder.domain.service;

import com.my.reminder.domain.model.FireEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 왜: 다음 발송 시각 순으로 대기 일정을 정렬하면서, 시각이 바뀐 일정을 위치가 아닌 id로 교체/제거하기 위함.
 * <p>
 * 힙과 id→위치 맵을 함께 유지한다. 같은 시각이면 먼저 들어온 항목이 먼저 나온다.
 * 일정 하나당 항목은 최대 하나이다.
 */
public class FireQueue {

    private final List<Node> heap = new ArrayList<>();
    private final Map<String, Integer> positions = new HashMap<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private long sequence;

    /**
     * 항목을 넣는다. 같은 id가 이미 있으면 버전이 낮지 않을 때만 교체한다.
     *
     * @return 큐에 반영되었으면 true
     */
    public boolean offer(FireEntry entry) {
        synchronized (this) {
            Integer index = positions.get(entry.eventId());
            if (index != null) {
                if (heap.get(index).entry.version() > entry.version()) {
                    return false;
                }
                removeAt(index);
            }
            Node node = new Node(entry, sequence++);
            heap.add(node);
            positions.put(entry.eventId(), heap.size() - 1);
            siftUp(heap.size() - 1);
        }
        notifyListeners();
        return true;
    }

    public synchronized Optional<FireEntry> peek() {
        return heap.isEmpty() ? Optional.empty() : Optional.of(heap.get(0).entry);
    }

    public synchronized Optional<Instant> nextDeadline() {
        return peek().map(FireEntry::fireAt);
    }

    public synchronized Optional<FireEntry> poll() {
        if (heap.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(removeAt(0));
    }

    /**
     * 발송 시각이 {@code now} 이하인 항목을 모두 꺼낸다.
     */
    public synchronized List<FireEntry> pollDue(Instant now) {
        List<FireEntry> due = new ArrayList<>();
        while (!heap.isEmpty() && heap.get(0).entry.isDue(now)) {
            due.add(removeAt(0));
        }
        return due;
    }

    /**
     * id로 항목을 제거한다. 없으면 아무 일도 하지 않는다.
     */
    public boolean remove(String eventId) {
        boolean removed;
        synchronized (this) {
            Integer index = positions.get(eventId);
            removed = index != null;
            if (removed) {
                removeAt(index);
            }
        }
        if (removed) {
            notifyListeners();
        }
        return removed;
    }

    public synchronized boolean contains(String eventId) {
        return positions.containsKey(eventId);
    }

    public synchronized Optional<FireEntry> get(String eventId) {
        Integer index = positions.get(eventId);
        return index == null ? Optional.empty() : Optional.of(heap.get(index).entry);
    }

    public synchronized int size() {
        return heap.size();
    }

    public synchronized boolean isEmpty() {
        return heap.isEmpty();
    }

    public void clear() {
        synchronized (this) {
            heap.clear();
            positions.clear();
        }
        notifyListeners();
    }

    /**
     * 큐 내용이 바뀔 때마다 호출된다. 스케줄러가 대기를 깨우는 데 쓴다.
     */
    public void addListener(Runnable listener) {
        listeners.add(listener);
    }

    private void notifyListeners() {
        for (Runnable listener : listeners) {
            listener.run();
        }
    }

    private FireEntry removeAt(int index) {
        Node removed = heap.get(index);
        int last = heap.size() - 1;
        if (index != last) {
            swap(index, last);
        }
        heap.remove(last);
        positions.remove(removed.entry.eventId());
        if (index < heap.size()) {
            siftDown(index);
            siftUp(index);
        }
        return removed.entry;
    }

    private void siftUp(int index) {
        while (index > 0) {
            int parent = (index - 1) / 2;
            if (heap.get(index).compareTo(heap.get(parent)) >= 0) {
                return;
            }
            swap(index, parent);
            index = parent;
        }
    }

    private void siftDown(int index) {
        int size = heap.size();
        while (true) {
            int left = 2 * index + 1;
            int right = left + 1;
            int smallest = index;
            if (left < size && heap.get(left).compareTo(heap.get(smallest)) < 0) {
                smallest = left;
            }
            if (right < size && heap.get(right).compareTo(heap.get(smallest)) < 0) {
                smallest = right;
            }
            if (smallest == index) {
                return;
            }
            swap(index, smallest);
            index = smallest;
        }
    }

    private void swap(int i, int j) {
        Node a = heap.get(i);
        Node b = heap.get(j);
        heap.set(i, b);
        heap.set(j, a);
        positions.put(b.entry.eventId(), i);
        positions.put(a.entry.eventId(), j);
    }

    private record Node(FireEntry entry, long sequence) implements Comparable<Node> {
        @Override
        public int compareTo(Node other) {
            int byTime = entry.fireAt().compareTo(other.entry.fireAt());
            return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
        }
    }
}
