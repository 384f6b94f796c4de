package io.taskhooks.core.testkit;

/** Builds work-item Markdown documents for tests. */
public final class TaskDocuments {

    private TaskDocuments() {}

    /**
     * A document with front matter and an acceptance criteria section.
     *
     * @param checked one flag per criterion
     */
    public static String task(String id, String title, String status, boolean... checked) {
        StringBuilder sb = new StringBuilder();
        sb.append("---\n");
        sb.append("id: ").append(id).append('\n');
        sb.append("title: ").append(title).append('\n');
        sb.append("status: ").append(status).append('\n');
        sb.append("priority: high\n");
        sb.append("labels: [backend, api]\n");
        sb.append("---\n\n");
        sb.append("## Description\n\nSome text.\n\n");
        sb.append("## Acceptance Criteria\n");
        for (int i = 0; i < checked.length; i++) {
            sb.append("- [").append(checked[i] ? 'x' : ' ').append("] #").append(i + 1)
                    .append(" Criterion ").append(i + 1).append('\n');
        }
        return sb.toString();
    }

    /** Conventional store path for an item. */
    public static String path(String id, String title) {
        return "backlog/tasks/" + id + " - " + title + ".md";
    }
}
