/**
 * Two parser front-ends over one {@link works.quarry.parser.Grammar grammar}.
 * <p>
 * {@link works.quarry.parser.TreeParser} materializes a whole document;
 * {@link works.quarry.parser.EventParser} delivers it one {@link works.quarry.parser.ParseEvent event} at a time.
 * Both are driven by the same {@link works.quarry.parser.GrammarDriver}
 * with different {@link works.quarry.parser.ParseActions}, so for any input,
 * they either agree on the document or fail with the same fault.
 */
package works.quarry.parser;
