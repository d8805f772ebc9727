package co.fanki.flowengine.config;

import co.fanki.flowengine.flow.domain.FlowElements;
import co.fanki.flowengine.flow.domain.OutlineFlowBuilder;
import co.fanki.flowengine.layout.domain.LayoutDirection;
import co.fanki.flowengine.layout.domain.LayoutOptions;
import co.fanki.flowengine.layout.domain.TidyOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Engine beans and the layout defaults read from {@code flow.layout.*} and
 * {@code flow.tidy.*}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class LayoutConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            LayoutConfiguration.class);

    /**
     * Default settings of the layered auto-arrange.
     *
     * @param direction TB or LR
     * @param nodeWidth the node width
     * @param nodeHeight the node height
     * @param rankSeparation the gap between ranks
     * @param nodeSeparation the gap between nodes of a rank
     * @param margin the gap to the canvas origin
     * @return the layout options
     */
    @Bean
    public LayoutOptions layoutOptions(
            @Value("${flow.layout.direction:LR}") final String direction,
            @Value("${flow.layout.node-width:280}") final double nodeWidth,
            @Value("${flow.layout.node-height:180}") final double nodeHeight,
            @Value("${flow.layout.rank-separation:80}")
            final double rankSeparation,
            @Value("${flow.layout.node-separation:50}")
            final double nodeSeparation,
            @Value("${flow.layout.margin:40}") final double margin) {

        final LayoutOptions options = new LayoutOptions(
                LayoutDirection.fromCode(direction), nodeWidth, nodeHeight,
                rankSeparation, nodeSeparation, margin);
        LOG.info("Layered layout defaults: {}", options);
        return options;
    }

    /**
     * Default settings of the tidy cleanup.
     *
     * @param direction TB or LR
     * @param nodeWidth the node width
     * @param nodeHeight the node height
     * @param minGapX the minimum horizontal gap
     * @param minGapY the minimum vertical gap
     * @param gridSize the grid unit
     * @return the tidy options
     */
    @Bean
    public TidyOptions tidyOptions(
            @Value("${flow.tidy.direction:LR}") final String direction,
            @Value("${flow.tidy.node-width:280}") final double nodeWidth,
            @Value("${flow.tidy.node-height:180}") final double nodeHeight,
            @Value("${flow.tidy.min-gap-x:40}") final double minGapX,
            @Value("${flow.tidy.min-gap-y:40}") final double minGapY,
            @Value("${flow.tidy.grid-size:20}") final double gridSize) {

        final TidyOptions options = new TidyOptions(nodeWidth, nodeHeight,
                minGapX, minGapY, gridSize,
                LayoutDirection.fromCode(direction));
        LOG.info("Tidy layout defaults: {}", options);
        return options;
    }

    /**
     * Factory of nodes, edges and options with random ids.
     *
     * @return the element factory
     */
    @Bean
    public FlowElements flowElements() {
        return FlowElements.defaults();
    }

    /**
     * Builder of flows from question outlines.
     *
     * @param flowElements the element factory
     * @return the outline builder
     */
    @Bean
    public OutlineFlowBuilder outlineFlowBuilder(
            final FlowElements flowElements) {
        return new OutlineFlowBuilder(flowElements);
    }
}
