package ai.afi.extractor.parse;

/**
 * Action taken for a tagged line in a given section state.
 */
@FunctionalInterface
interface LineHandler {

    LineHandler IGNORE = (context, line) -> line.index();

    /**
     * @return index of the last line consumed, at least {@code line.index()}
     */
    int handle(ParserContext context, TaggedLine line);
}
