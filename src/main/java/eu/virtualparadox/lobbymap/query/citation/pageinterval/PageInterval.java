package eu.virtualparadox.lobbymap.query.citation.pageinterval;

public record PageInterval(int fromPage, int toPage) {

    public String asString() {
        if (fromPage == toPage) {
            return String.valueOf(fromPage);
        }
        return fromPage + "-" + toPage;
    }
}
