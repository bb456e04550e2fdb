package io.troupe.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.troupe.core.criteria.SuccessCriteria;
import io.troupe.core.form.FormSchema;
import io.troupe.core.report.Report;
import io.troupe.core.routing.Tier;
import io.troupe.core.routing.TierStrategy;
import io.troupe.core.template.CompositionRule;
import io.troupe.core.template.ConfigMapping;
import io.troupe.core.template.ResponseCondition;
import io.troupe.core.template.Template;
import io.troupe.serialization.mixin.CompositionRuleBuilderMixin;
import io.troupe.serialization.mixin.CompositionRuleMixin;
import io.troupe.serialization.mixin.ReportBuilderMixin;
import io.troupe.serialization.mixin.ReportMixin;
import io.troupe.serialization.mixin.TemplateBuilderMixin;
import io.troupe.serialization.mixin.TemplateMixin;
import io.troupe.serialization.mixin.TierMixin;
import io.troupe.serialization.mixin.TierStrategyMixin;
import java.io.Serial;

/**
 * Jackson module for the Troupe model.
 *
 * <p>Registers custom serializers for the types that have no bean shape (conditions, config
 * mappings, success criteria, form schemas) and mixins that route the builder-based types
 * through their builders.
 *
 * @see TemplateSerializer#createMapper()
 */
public class TroupeJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 2150937319448273605L;

    public TroupeJacksonModule() {
        super("TroupeJacksonModule");

        addSerializer(ResponseCondition.class, new ResponseConditionSerializer());
        addDeserializer(ResponseCondition.class, new ResponseConditionDeserializer());

        addSerializer(ConfigMapping.class, new ConfigMappingSerializer());
        addDeserializer(ConfigMapping.class, new ConfigMappingDeserializer());

        addSerializer(SuccessCriteria.class, new SuccessCriteriaSerializer());
        addDeserializer(SuccessCriteria.class, new SuccessCriteriaDeserializer());

        addSerializer(FormSchema.class, new FormSchemaSerializer());
        addDeserializer(FormSchema.class, new FormSchemaDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Template.class, TemplateMixin.class);
        context.setMixInAnnotations(Template.Builder.class, TemplateBuilderMixin.class);

        context.setMixInAnnotations(CompositionRule.class, CompositionRuleMixin.class);
        context.setMixInAnnotations(
                CompositionRule.Builder.class, CompositionRuleBuilderMixin.class);

        context.setMixInAnnotations(Report.class, ReportMixin.class);
        context.setMixInAnnotations(Report.Builder.class, ReportBuilderMixin.class);

        context.setMixInAnnotations(Tier.class, TierMixin.class);
        context.setMixInAnnotations(TierStrategy.class, TierStrategyMixin.class);
    }
}
